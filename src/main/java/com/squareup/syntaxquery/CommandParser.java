package com.squareup.syntaxquery;

/**
 * The parser turning a raw command buffer into a token tree. The highlighting
 * engine never tokenizes text itself; an implementation of this interface is
 * supplied by the surrounding shell.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
@FunctionalInterface
public interface CommandParser {

  /**
   * <p>
   *   Parse a buffer. This must not throw on malformed input: a best-effort
   *   token tree is returned instead, with {@link ParseResult#complete} set to false.
   * </p>
   *
   * @param buffer The current text of the command line.
   *
   * @return The token tree for the buffer.
   */
  ParseResult parse(String buffer);
}

package com.squareup.syntaxquery;

import java.util.Collections;
import java.util.List;

/**
 * The result of parsing a command buffer: the token tree, and whether the
 * buffer was a syntactically complete command (no open quote, paren or heredoc).
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class ParseResult {

  /** An empty, complete parse. This is what an empty buffer parses to. */
  public static final ParseResult EMPTY = new ParseResult(true, Collections.emptyList());

  /** If true, the buffer parsed as a terminated command. */
  public final boolean complete;
  /** The root sibling list of the token tree. */
  public final List<Token> tokens;

  /**
   * Create a parse result.
   *
   * @param complete See {@link #complete}.
   * @param tokens See {@link #tokens}.
   */
  public ParseResult(boolean complete, List<Token> tokens) {
    this.complete = complete;
    this.tokens = List.copyOf(tokens);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return (complete ? "complete" : "incomplete") + tokens;
  }
}

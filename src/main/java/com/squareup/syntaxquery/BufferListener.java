package com.squareup.syntaxquery;

import java.util.List;

/**
 * A consumer of the token tree, notified by the {@link SyntaxHighlighter} each
 * time the buffer is reparsed.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
@FunctionalInterface
public interface BufferListener {

  /**
   * Called after the buffer was reparsed.
   *
   * @param tokens The root sibling list of the new token tree.
   * @param buffer The buffer the tree was parsed from.
   *
   * @return True if this listener is done, and should be removed.
   */
  boolean onReparse(List<Token> tokens, String buffer);
}

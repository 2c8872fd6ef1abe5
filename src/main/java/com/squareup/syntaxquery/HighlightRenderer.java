package com.squareup.syntaxquery;

/**
 * <p>
 *   The drawing surface the highlighter paints onto. Spans live in namespaces,
 *   so that several producers (e.g., the syntax highlighter and the
 *   {@link BracketHighlighter}) can each replace their own spans without
 *   touching anyone else's.
 * </p>
 *
 * <p>
 *   Spans are added in paint order; where they overlap, a later span wins for
 *   every attribute it sets.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public interface HighlightRenderer {

  /** @return A fresh namespace id, distinct from every other id this renderer handed out. */
  int newNamespace();

  /** Remove every span in the given namespace. */
  void clearNamespace(int namespace);

  /** Add a span to the given namespace, on top of the spans already there. */
  void addHighlight(HighlightSpan span, int namespace);

  /** Ask for the buffer to be redrawn with the current spans. */
  void requestRedraw();
}

package com.squareup.syntaxquery;

import java.util.Comparator;
import java.util.Objects;

/**
 * <p>
 *   A styled range of the buffer: the unit of output of the highlighter. Spans are
 *   handed to a {@link HighlightRenderer} sorted by {@link #ORDER}, and later spans
 *   paint over earlier ones where they overlap.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class HighlightSpan {

  /** The paint order of spans: by priority, then by emission order. */
  public static final Comparator<HighlightSpan> ORDER = Comparator
      .comparingLong((HighlightSpan span) -> span.priority)
      .thenComparingInt(span -> span.order);

  /** The start of the span in the buffer, inclusive. */
  public final int start;
  /** The end of the span in the buffer, exclusive. */
  public final int finish;
  /** The name of the style, as registered in the {@link StyleRegistry}. */
  public final String styleName;
  /** The style to paint the span with. */
  public final Style style;
  /** The effective priority of the span. See {@link RuleHit#effectivePriority()}. */
  public final long priority;
  /** The emission index of the span, breaking ties in {@link #priority}. */
  public final int order;

  /** The straightforward constructor. */
  public HighlightSpan(int start, int finish, String styleName, Style style,
      long priority, int order) {
    this.start = start;
    this.finish = finish;
    this.styleName = styleName;
    this.style = style;
    this.priority = priority;
    this.order = order;
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    HighlightSpan that = (HighlightSpan) o;
    return start == that.start &&
        finish == that.finish &&
        priority == that.priority &&
        order == that.order &&
        styleName.equals(that.styleName) &&
        style.equals(that.style);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(start, finish, styleName, style, priority, order);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return styleName + "[" + start + "," + finish + ")@" + priority + "#" + order;
  }
}

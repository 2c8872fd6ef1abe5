package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * <p>
 *   A {@link HighlightRenderer} painting onto a JLine {@link AttributedString}.
 *   Namespaces are painted in the order they were created, and the spans of a
 *   namespace in the order they were added. Each span only overrides the
 *   attributes its {@link Style} sets, so an outer colour shows through a span
 *   that only makes its text bold.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class AttributedHighlightRenderer implements HighlightRenderer {

  /** The spans in each namespace, keyed on namespace id. */
  private final Map<Integer, List<HighlightSpan>> namespaces = new TreeMap<>();
  /** Called whenever a redraw is requested. */
  private final Runnable redraw;
  /** The last namespace id handed out. */
  private int namespaceCounter = 0;

  /**
   * Create a renderer.
   *
   * @param redraw Called whenever a producer asks for a redraw; e.g., to
   *               refresh the line of a JLine <code>LineReader</code>.
   */
  public AttributedHighlightRenderer(Runnable redraw) {
    this.redraw = redraw;
  }

  /** Create a renderer which is only ever drawn on demand, through {@link #render(String)}. */
  public AttributedHighlightRenderer() {
    this(() -> {});
  }

  /** {@inheritDoc} */
  @Override public int newNamespace() {
    namespaceCounter += 1;
    namespaces.put(namespaceCounter, new ArrayList<>());
    return namespaceCounter;
  }

  /** {@inheritDoc} */
  @Override public void clearNamespace(int namespace) {
    List<HighlightSpan> spans = namespaces.get(namespace);
    if (spans != null) {
      spans.clear();
    }
  }

  /** {@inheritDoc} */
  @Override public void addHighlight(HighlightSpan span, int namespace) {
    List<HighlightSpan> spans = namespaces.get(namespace);
    if (spans == null) {
      throw new IllegalArgumentException("Unknown highlight namespace: " + namespace);
    }
    spans.add(span);
  }

  /** {@inheritDoc} */
  @Override public void requestRedraw() {
    redraw.run();
  }

  /** @return The spans currently in the given namespace, in paint order. */
  public List<HighlightSpan> spans(int namespace) {
    List<HighlightSpan> spans = namespaces.get(namespace);
    return spans == null ? List.of() : List.copyOf(spans);
  }

  /**
   * Paint every span onto a buffer. Spans reaching past the end of the buffer are
   * clipped, since the buffer may have changed since they were computed.
   *
   * @param buffer The text to paint.
   *
   * @return The styled text.
   */
  public AttributedString render(String buffer) {
    AttributedStyle[] styles = new AttributedStyle[buffer.length()];
    Arrays.fill(styles, AttributedStyle.DEFAULT);
    for (List<HighlightSpan> spans : namespaces.values()) {
      for (HighlightSpan span : spans) {
        int end = Math.min(span.finish, buffer.length());
        for (int i = Math.max(0, span.start); i < end; ++i) {
          styles[i] = paint(styles[i], span.style);
        }
      }
    }

    AttributedStringBuilder b = new AttributedStringBuilder(buffer.length());
    int runStart = 0;
    for (int i = 1; i <= buffer.length(); ++i) {
      if (i == buffer.length() || !styles[i].equals(styles[runStart])) {
        b.append(buffer.substring(runStart, i), styles[runStart]);
        runStart = i;
      }
    }
    return b.toAttributedString();
  }

  /**
   * Paint a style over an existing JLine style, overriding only the attributes the
   * style sets.
   *
   * @param base The style underneath.
   * @param style The style to paint on top.
   *
   * @return The combined style.
   */
  static AttributedStyle paint(AttributedStyle base, Style style) {
    AttributedStyle s = base;
    if (style.fg != null) {
      switch (style.fg.kind) {
        case RESET:
          s = s.foregroundDefault();
          break;
        case RGB:
          s = s.foregroundRgb(style.fg.value);
          break;
        default:
          s = s.foreground(style.fg.value);
          break;
      }
    }
    if (style.bg != null) {
      switch (style.bg.kind) {
        case RESET:
          s = s.backgroundDefault();
          break;
        case RGB:
          s = s.backgroundRgb(style.bg.value);
          break;
        default:
          s = s.background(style.bg.value);
          break;
      }
    }
    if (style.bold != null) { s = style.bold ? s.bold() : s.boldOff(); }
    if (style.dim != null) { s = style.dim ? s.faint() : s.faintOff(); }
    if (style.italic != null) { s = style.italic ? s.italic() : s.italicOff(); }
    if (style.underline != null) { s = style.underline ? s.underline() : s.underlineOff(); }
    if (style.strikethrough != null) {
      s = style.strikethrough ? s.crossedOut() : s.crossedOutOff();
    }
    if (style.reversed != null) { s = style.reversed ? s.inverse() : s.inverseOff(); }
    if (style.blink != null) { s = style.blink ? s.blink() : s.blinkOff(); }
    return s;
  }
}

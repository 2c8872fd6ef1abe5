package com.squareup.syntaxquery;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.junit.jupiter.api.Test;

/**
 * Unit test {@link AttributedHighlightRenderer}.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
class AttributedHighlightRendererTest {

  private static final Style RED = Style.builder().fg(Color.parse("red")).build();
  private static final Style BOLD = Style.builder().bold(true).build();

  private static HighlightSpan span(int start, int finish, String name, Style style) {
    return new HighlightSpan(start, finish, name, style, 0L, 0);
  }

  @Test void renderPlain() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    AttributedString rendered = renderer.render("ls -l");
    assertEquals("ls -l", rendered.toString());
    for (int i = 0; i < rendered.length(); ++i) {
      assertEquals(AttributedStyle.DEFAULT, rendered.styleAt(i));
    }
  }

  @Test void renderEmpty() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int ns = renderer.newNamespace();
    renderer.addHighlight(span(0, 3, "red", RED), ns);
    assertEquals("", renderer.render("").toString());
  }

  @Test void renderSpan() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int ns = renderer.newNamespace();
    renderer.addHighlight(span(3, 5, "red", RED), ns);
    AttributedString rendered = renderer.render("ls -l");
    assertEquals("ls -l", rendered.toString());
    assertEquals(AttributedStyle.DEFAULT, rendered.styleAt(2));
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED), rendered.styleAt(3));
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED), rendered.styleAt(4));
  }

  @Test void spansBlend() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int ns = renderer.newNamespace();
    renderer.addHighlight(span(0, 5, "red", RED), ns);
    renderer.addHighlight(span(0, 2, "bold", BOLD), ns);
    AttributedString rendered = renderer.render("ls -l");
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED).bold(), rendered.styleAt(0));
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED), rendered.styleAt(3));
  }

  @Test void laterNamespacePaintsOver() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int first = renderer.newNamespace();
    int second = renderer.newNamespace();
    renderer.addHighlight(span(0, 2, "blue", Style.builder().fg(Color.parse("blue")).build()), second);
    renderer.addHighlight(span(0, 2, "red", RED), first);
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE),
        renderer.render("ls").styleAt(0));
  }

  @Test void spansAreClipped() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int ns = renderer.newNamespace();
    renderer.addHighlight(span(1, 10, "red", RED), ns);
    AttributedString rendered = renderer.render("ls");
    assertEquals("ls", rendered.toString());
    assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED), rendered.styleAt(1));
  }

  @Test void clearNamespace() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    int ns = renderer.newNamespace();
    renderer.addHighlight(span(0, 2, "red", RED), ns);
    assertEquals(1, renderer.spans(ns).size());
    renderer.clearNamespace(ns);
    assertEquals(List.of(), renderer.spans(ns));
    assertEquals(AttributedStyle.DEFAULT, renderer.render("ls").styleAt(0));
  }

  @Test void unknownNamespace() {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    assertThrows(IllegalArgumentException.class, () -> renderer.addHighlight(span(0, 1, "red", RED), 42));
    assertEquals(List.of(), renderer.spans(42));
  }

  @Test void redrawCallback() {
    AtomicInteger redraws = new AtomicInteger();
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer(redraws::incrementAndGet);
    renderer.requestRedraw();
    renderer.requestRedraw();
    assertEquals(2, redraws.get());
  }

  @Test void paintColors() {
    assertEquals(AttributedStyle.DEFAULT.foregroundRgb(0xffaaaa),
        AttributedHighlightRenderer.paint(AttributedStyle.DEFAULT,
            Style.builder().fg(Color.parse("#ffaaaa")).build()));
    assertEquals(AttributedStyle.DEFAULT.background(AttributedStyle.RED),
        AttributedHighlightRenderer.paint(AttributedStyle.DEFAULT,
            Style.builder().bg(Color.parse("red")).build()));
    AttributedStyle red = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
    assertEquals(AttributedStyle.DEFAULT.foregroundDefault(),
        AttributedHighlightRenderer.paint(red, Style.builder().fg(Color.RESET).build()));
  }

  @Test void paintToggles() {
    AttributedStyle bold = AttributedHighlightRenderer.paint(AttributedStyle.DEFAULT, BOLD);
    assertEquals(AttributedStyle.DEFAULT.bold(), bold);
    assertEquals(AttributedStyle.DEFAULT.bold().boldOff(),
        AttributedHighlightRenderer.paint(bold, Style.builder().bold(false).build()));
    assertEquals(AttributedStyle.DEFAULT.underline().italic(),
        AttributedHighlightRenderer.paint(AttributedStyle.DEFAULT,
            Style.builder().underline(true).italic(true).build()));
    assertEquals(bold, AttributedHighlightRenderer.paint(bold, Style.EMPTY));
  }
}

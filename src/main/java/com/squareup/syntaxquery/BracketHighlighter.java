package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * <p>
 *   Colours matching brackets by their nesting level, and marks unmatched
 *   brackets as errors. The brackets are found by querying the token tree with a
 *   single rule, and are paired with a stack in buffer order. This runs as a
 *   {@link BufferListener} of a {@link SyntaxHighlighter}, and paints into its
 *   own namespace of the renderer.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class BracketHighlighter implements BufferListener {

  /** The rule finding bracket tokens, at any depth. */
  static final Rule BRACKETS = Rule.of(TokenMatcher.builder().regex("^[(){}]$").build());

  /** Opening brackets, mapped to the bracket closing them. */
  private static final Map<String, String> CLOSING = Map.of(
      "(", ")",
      "{", "}");

  /** The colours of matched brackets, rotating by nesting level. */
  public static final List<Style> DEFAULT_PALETTE = List.of(
      Style.builder().fg(Color.parse("lightblue")).build(),
      Style.builder().fg(Color.parse("lightred")).build(),
      Style.builder().fg(Color.parse("lightgreen")).build(),
      Style.builder().fg(Color.parse("lightyellow")).build());

  /** The style of a bracket without a partner. */
  public static final Style DEFAULT_UNMATCHED = Style.builder().bg(Color.parse("red")).build();

  /** A bracket found in the buffer, and what we know about its partner. */
  private static final class Bracket {
    final Token token;
    /** The closing bracket we're waiting for, or null if this is a closing bracket. */
    @Nullable final String closer;
    boolean matched = false;

    Bracket(Token token, @Nullable String closer) {
      this.token = token;
      this.closer = closer;
    }
  }

  /** The rule set wrapping {@link #BRACKETS}. */
  private final RuleSet rules = new RuleSet(List.of(BRACKETS), StyleRegistry.empty());
  /** The renderer we paint onto. */
  private final HighlightRenderer renderer;
  /** Our namespace in {@link #renderer}. */
  private final int namespace;
  /** See {@link #DEFAULT_PALETTE}. */
  private final List<Style> palette;
  /** See {@link #DEFAULT_UNMATCHED}. */
  private final Style unmatched;
  /** If true, we painted brackets last time, and need to redraw to clear them. */
  private boolean hadBrackets = false;

  /**
   * Create a bracket highlighter.
   *
   * @param renderer The renderer to paint onto. A new namespace is allocated in it.
   * @param palette The colours of matched brackets. Must not be empty.
   * @param unmatched The style of unmatched brackets.
   */
  public BracketHighlighter(HighlightRenderer renderer, List<Style> palette, Style unmatched) {
    if (palette.isEmpty()) {
      throw new IllegalArgumentException("The bracket palette must have at least one style");
    }
    this.renderer = renderer;
    this.namespace = renderer.newNamespace();
    this.palette = List.copyOf(palette);
    this.unmatched = unmatched;
  }

  /** Create a bracket highlighter with the default colours. */
  public BracketHighlighter(HighlightRenderer renderer) {
    this(renderer, DEFAULT_PALETTE, DEFAULT_UNMATCHED);
  }

  /** {@inheritDoc} */
  @Override public boolean onReparse(List<Token> tokens, String buffer) {
    renderer.clearNamespace(namespace);
    List<HighlightSpan> spans = highlight(tokens, buffer);
    for (HighlightSpan span : spans) {
      renderer.addHighlight(span, namespace);
    }
    if (hadBrackets || !spans.isEmpty()) {
      renderer.requestRedraw();
    }
    hadBrackets = !spans.isEmpty();
    return false;
  }

  /**
   * Compute the bracket spans for a token tree.
   *
   * @param tokens The root sibling list of the tree.
   * @param buffer The buffer the tree was parsed from.
   *
   * @return One span per bracket, in buffer order.
   */
  List<HighlightSpan> highlight(List<Token> tokens, String buffer) {
    List<Token> found = new ArrayList<>(rules.query(tokens, buffer));
    found.sort(Comparator.comparingInt(Token::start));

    // Pair up the brackets
    List<Bracket> brackets = new ArrayList<>(found.size());
    List<Bracket> stack = new ArrayList<>();
    for (Token token : found) {
      String text = token.text(buffer);
      Bracket bracket = new Bracket(token, CLOSING.get(text));
      brackets.add(bracket);
      if (bracket.closer != null) {
        stack.add(bracket);
      } else {
        for (int i = stack.size() - 1; i >= 0; --i) {
          if (text.equals(stack.get(i).closer)) {
            bracket.matched = true;
            stack.get(i).matched = true;
            // Anything opened after our partner is left unmatched
            stack.subList(i, stack.size()).clear();
            break;
          }
        }
      }
    }

    // Colour them by level
    List<HighlightSpan> spans = new ArrayList<>(brackets.size());
    int level = 0;
    for (Bracket bracket : brackets) {
      Style style;
      String name;
      if (bracket.matched) {
        boolean opening = bracket.closer != null;
        if (opening) {
          level += 1;
        }
        int index = level % palette.size();
        style = palette.get(index);
        name = "bracket" + index;
        if (!opening) {
          level -= 1;
        }
      } else {
        style = unmatched;
        name = "error";
      }
      spans.add(new HighlightSpan(bracket.token.start(), bracket.token.finish(), name, style,
          0, spans.size()));
    }
    return spans;
  }

  /** @return The namespace this highlighter paints into. */
  public int namespace() {
    return namespace;
  }
}

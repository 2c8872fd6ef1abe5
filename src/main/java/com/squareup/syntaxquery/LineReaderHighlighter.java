package com.squareup.syntaxquery;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.jline.reader.Highlighter;
import org.jline.reader.LineReader;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * <p>
 *   Plugs a {@link SyntaxHighlighter} into a JLine {@link LineReader}. JLine calls
 *   {@link #highlight(LineReader, String)} whenever it redraws the line; we feed
 *   the buffer to the syntax highlighter, which reparses only if needed, and then
 *   paint whatever is in the {@link AttributedHighlightRenderer}.
 * </p>
 *
 * <p>
 *   JLine's own error markers are honored as well: text matching the error
 *   pattern, and the character at the error index, are shown in reverse video on
 *   top of the syntax highlights.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class LineReaderHighlighter implements Highlighter {

  /** The highlighter reacting to buffer changes. */
  private final SyntaxHighlighter syntax;
  /** The renderer {@link #syntax} paints into. */
  private final AttributedHighlightRenderer renderer;
  /** The error pattern set by JLine, if any. */
  @Nullable private Pattern errorPattern = null;
  /** The error index set by JLine, or -1 if there is none. */
  private int errorIndex = -1;

  /**
   * Create a highlighter.
   *
   * @param syntax The syntax highlighter, painting into the given renderer.
   * @param renderer The renderer to read the highlights from.
   */
  public LineReaderHighlighter(SyntaxHighlighter syntax, AttributedHighlightRenderer renderer) {
    this.syntax = syntax;
    this.renderer = renderer;
  }

  /**
   * Wire up a syntax highlighter and bracket colouring with the given parser and
   * rules.
   *
   * @param parser The parser for the command line.
   * @param rules The rules to highlight with.
   *
   * @return A highlighter ready to be set on a JLine <code>LineReader</code>.
   */
  public static LineReaderHighlighter create(CommandParser parser, RuleSet rules) {
    AttributedHighlightRenderer renderer = new AttributedHighlightRenderer();
    SyntaxHighlighter syntax = new SyntaxHighlighter(parser, rules, renderer);
    syntax.addBufferListener(new BracketHighlighter(renderer));
    return new LineReaderHighlighter(syntax, renderer);
  }

  /** {@inheritDoc} */
  @Override public AttributedString highlight(LineReader reader, String buffer) {
    syntax.onBufferChange(buffer);
    AttributedString highlighted = renderer.render(buffer);
    if (errorPattern == null && (errorIndex < 0 || errorIndex >= buffer.length())) {
      return highlighted;
    }

    boolean[] error = new boolean[buffer.length()];
    if (errorPattern != null) {
      Matcher m = errorPattern.matcher(buffer);
      while (m.find()) {
        for (int i = m.start(); i < m.end(); ++i) {
          error[i] = true;
        }
      }
    }
    if (errorIndex >= 0 && errorIndex < buffer.length()) {
      error[errorIndex] = true;
    }

    AttributedStringBuilder b = new AttributedStringBuilder(buffer.length());
    for (int i = 0; i < buffer.length(); ++i) {
      AttributedStyle style = highlighted.styleAt(i);
      b.append(String.valueOf(buffer.charAt(i)), error[i] ? style.inverse() : style);
    }
    return b.toAttributedString();
  }

  /** {@inheritDoc} */
  @Override public void setErrorPattern(Pattern errorPattern) {
    this.errorPattern = errorPattern;
  }

  /** {@inheritDoc} */
  @Override public void setErrorIndex(int errorIndex) {
    this.errorIndex = errorIndex;
  }

  /** @return The syntax highlighter driven by this JLine highlighter. */
  public SyntaxHighlighter syntax() {
    return syntax;
  }
}

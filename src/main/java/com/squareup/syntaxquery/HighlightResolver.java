package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   Turns the hits of a {@link RuleSet} into the sorted list of
 *   {@link HighlightSpan}s handed to a {@link HighlightRenderer}.
 * </p>
 *
 * <p>
 *   A hit whose matcher has no style produces nothing. A hit whose matcher has a
 *   style but no <code>hlregex</code> produces one span over its token. A hit with an
 *   <code>hlregex</code> produces one span per match of the regex inside the token's
 *   text, covering the first capture group if the regex has one and the whole
 *   match otherwise.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class HighlightResolver {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(HighlightResolver.class);

  /** Static methods only. */
  private HighlightResolver() {}

  /**
   * Resolve hits into spans.
   *
   * @param hits The hits from {@link RuleSet#apply(List, String)}, in emission order.
   * @param styles The styles to resolve the hits' style names against.
   * @param source The buffer the hits' tokens were parsed from.
   *
   * @return The spans, sorted into paint order by {@link HighlightSpan#ORDER}.
   */
  public static List<HighlightSpan> resolve(List<RuleHit> hits, StyleRegistry styles,
      String source) {
    List<HighlightSpan> spans = new ArrayList<>();
    for (RuleHit ruleHit : hits) {
      TokenMatcher matcher = ruleHit.hit.matcher;
      if (matcher.hl == null) {
        continue;
      }
      Style style = styles.get(matcher.hl);
      if (style == null) {
        // RuleSet validates style names at construction, so this is a programming error
        throw new IllegalStateException("No style registered for '" + matcher.hl + "'");
      }
      Token token = ruleHit.hit.token;
      long priority = ruleHit.effectivePriority();
      if (matcher.hlRegex == null) {
        spans.add(new HighlightSpan(token.start(), token.finish(), matcher.hl, style,
            priority, spans.size()));
      } else {
        Matcher m = matcher.hlRegex.matcher(token.text(source));
        boolean useGroup = m.groupCount() > 0;
        while (m.find()) {
          int begin = useGroup ? m.start(1) : m.start();
          int end = useGroup ? m.end(1) : m.end();
          if (begin < 0 || begin == end) {
            // The group did not participate, or matched nothing
            continue;
          }
          spans.add(new HighlightSpan(token.start() + begin, token.start() + end, matcher.hl,
              style, priority, spans.size()));
        }
      }
    }
    spans.sort(HighlightSpan.ORDER);
    return spans;
  }

  /**
   * Resolve the hits of a rule set over a token tree.
   *
   * @param rules The rules to apply.
   * @param tokens The root sibling list of the token tree.
   * @param source The buffer the tree was parsed from.
   *
   * @return The spans, in paint order.
   */
  public static List<HighlightSpan> resolve(RuleSet rules, List<Token> tokens, String source) {
    return resolve(rules.apply(tokens, source), rules.styles, source);
  }

  /**
   * Replace the contents of a renderer namespace with the given spans, and ask for
   * a redraw.
   *
   * @param spans The spans, in paint order.
   * @param renderer The renderer to paint to.
   * @param namespace The namespace to replace.
   */
  public static void render(List<HighlightSpan> spans, HighlightRenderer renderer,
      int namespace) {
    renderer.clearNamespace(namespace);
    for (HighlightSpan span : spans) {
      renderer.addHighlight(span, namespace);
    }
    renderer.requestRedraw();
    log.debug("Rendered {} spans into namespace {}", spans.size(), namespace);
  }
}

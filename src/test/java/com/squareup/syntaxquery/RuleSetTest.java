package com.squareup.syntaxquery;

import static com.squareup.syntaxquery.TokenTrees.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/**
 * Unit test {@link RuleSet} and {@link Rule}.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
class RuleSetTest {

  /** Render the hits of a rule set as <code>text@depth</code> strings. */
  private static List<String> hits(RuleSet rules, List<Token> tokens, String source) {
    return rules.apply(tokens, source).stream()
        .map(hit -> hit.hit.token.text(source) + "@" + hit.depth)
        .collect(Collectors.toList());
  }

  /**
   * Rules fire inside nested lists whether or not anything matched the parent.
   */
  @Test void nestedListsAreIndependent() {
    RuleSet rules = new RuleSet(
        List.of(rule("[kind:/STRING/ regex:/^ls$/ hl:command]")),
        StyleRegistry.defaults());
    assertEquals(List.of("ls@2"), hits(rules, substitutionTree(), SUBSTITUTION_BUFFER));
  }

  /**
   * Every rule is scanned at the root before anything nested, and rules run in order.
   */
  @Test void emissionOrder() {
    RuleSet rules = new RuleSet(List.of(
        rule("[kind:/substitution/ hl:normal]"),
        rule("[kind:/STRING/ hl:string]")),
        StyleRegistry.defaults());
    List<RuleHit> hits = rules.apply(substitutionTree(), SUBSTITUTION_BUFFER);
    assertEquals(
        List.of("echo@0", "\"a$(ls)b\"@0", "$(ls)@1", "ls@2"),
        hits(rules, substitutionTree(), SUBSTITUTION_BUFFER));
    for (int i = 0; i < hits.size(); ++i) {
      assertEquals(i, hits.get(i).order);
    }
    assertEquals(1, hits.get(0).ruleIndex);
    assertEquals(0, hits.get(2).ruleIndex);
  }

  /**
   * Hits found through a contains keep the depth of the scan that found them.
   */
  @Test void containsHitsKeepScanDepth() {
    RuleSet rules = new RuleSet(
        List.of(rule("[kind:/STRING/ contains:([kind:/substitution/ hl:normal])]")),
        StyleRegistry.defaults());
    List<RuleHit> hits = rules.apply(substitutionTree(), SUBSTITUTION_BUFFER);
    assertEquals(2, hits.size());
    assertEquals("$(ls)", hits.get(1).hit.token.text(SUBSTITUTION_BUFFER));
    assertEquals(0, hits.get(1).depth);
    assertEquals(0L, hits.get(1).effectivePriority());
  }

  /**
   * Declared priority dominates depth, and deeper hits rank higher.
   */
  @Test void effectivePriority() {
    Rule low = rule("[]");
    Rule high = rule("@1 []");
    Rule negative = rule("@-1 []");
    Token token = leaf(0, 1, "x");
    Hit hit = new Hit(low.sequence.get(0), token);
    assertEquals(0L, new RuleHit(hit, low, 0, 0, 0).effectivePriority());
    assertEquals(3L, new RuleHit(hit, low, 0, 3, 0).effectivePriority());
    assertEquals(RuleHit.DEPTH_SCALE + 5L, new RuleHit(hit, high, 0, 5, 0).effectivePriority());
    assertEquals(-RuleHit.DEPTH_SCALE + 2L,
        new RuleHit(hit, negative, 0, 2, 0).effectivePriority());
    // Very deep lists are clamped, so they never reach the next priority
    assertEquals(RuleHit.DEPTH_SCALE - 1L,
        new RuleHit(hit, low, 0, 5000, 0).effectivePriority());
    assertTrue(new RuleHit(hit, low, 0, 5000, 0).effectivePriority()
        < new RuleHit(hit, high, 0, 0, 0).effectivePriority());
    assertTrue(new RuleHit(hit, negative, 0, 5000, 0).effectivePriority()
        < new RuleHit(hit, low, 0, 0, 0).effectivePriority());
  }

  /**
   * Query returns the matched tokens, without styles.
   */
  @Test void query() {
    RuleSet rules = new RuleSet(List.of(rule("[kind:/STRING/]")), StyleRegistry.empty());
    assertEquals(
        List.of("echo", "\"a$(ls)b\"", "ls"),
        rules.query(substitutionTree(), SUBSTITUTION_BUFFER).stream()
            .map(token -> token.text(SUBSTITUTION_BUFFER))
            .collect(Collectors.toList()));
  }

  /**
   * An empty tree has no hits.
   */
  @Test void emptyTree() {
    RuleSet rules = RuleCompiler.loadDefaults();
    assertEquals(Collections.emptyList(), rules.apply(Collections.emptyList(), ""));
  }

  /**
   * Rules referring to a style missing from the registry are rejected.
   */
  @Test void unknownStyle() {
    Rule rule = Rule.of(TokenMatcher.builder()
        .contains(TokenMatcher.builder().hl("no_such_style").build())
        .build());
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new RuleSet(List.of(rule), StyleRegistry.defaults()));
    assertTrue(e.getMessage().contains("no_such_style"));
  }

  /**
   * Rules must have at least one matcher.
   */
  @Test void emptyRule() {
    assertThrows(IllegalArgumentException.class, () -> new Rule(Collections.emptyList()));
  }

  /**
   * Rules print in the rule language.
   */
  @Test void ruleToString() {
    assertEquals("rule [kind:/a/]*;", Rule.of(
        TokenMatcher.builder().kind("a").quantifier(Quantifier.STAR).build()).toString());
    assertEquals("rule strings: @-2 ^ [hl:string] $;", new Rule("strings",
        List.of(TokenMatcher.start(), TokenMatcher.builder().hl("string").build(),
            TokenMatcher.end()), -2).toString());
  }
}

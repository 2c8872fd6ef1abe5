package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 *   An ordered collection of {@link Rule}s, together with the {@link StyleRegistry}
 *   their <code>hl</code> fields refer to. This is the static configuration of the
 *   highlighter: it is built once, validated at construction, and then applied to
 *   the token tree of every parse.
 * </p>
 *
 * <p>
 *   Applying a rule set walks the tree depth-first. At every sibling list, the root
 *   included, every rule is scanned across the list in order. Whether a rule fires
 *   inside a token's nested list does not depend on whether anything matched the
 *   token itself.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class RuleSet {

  /** The rules, in declaration order. */
  public final List<Rule> rules;
  /** The styles the rules refer to. */
  public final StyleRegistry styles;

  /**
   * Create a rule set.
   *
   * @param rules See {@link #rules}.
   * @param styles See {@link #styles}.
   *
   * @throws IllegalArgumentException Thrown if a rule refers to a style not in the registry.
   */
  public RuleSet(List<Rule> rules, StyleRegistry styles) {
    this.rules = List.copyOf(rules);
    this.styles = styles;
    for (Rule rule : this.rules) {
      rule.forEachMatcher(matcher -> {
        if (matcher.hl != null && !styles.contains(matcher.hl)) {
          throw new IllegalArgumentException("Unknown style '" + matcher.hl + "' in " + rule);
        }
      });
    }
  }

  /**
   * Apply every rule to every sibling list of a token tree.
   *
   * @param tokens The root sibling list of the tree.
   * @param source The buffer the tree was parsed from.
   *
   * @return All of the hits, in emission order: the hits of each rule in turn at the
   *         root, followed by the hits found inside each root token's nested list,
   *         depth-first.
   */
  public List<RuleHit> apply(List<Token> tokens, String source) {
    List<RuleHit> hits = new ArrayList<>();
    apply(tokens, source, 0, hits);
    return hits;
  }

  /** The recursive implementation of {@link #apply(List, String)}. */
  private void apply(List<Token> siblings, String source, int depth, List<RuleHit> out) {
    for (int ruleIndex = 0; ruleIndex < rules.size(); ++ruleIndex) {
      Rule rule = rules.get(ruleIndex);
      for (SequenceMatch match : rule.scan(siblings, source)) {
        for (Hit hit : match.hits) {
          out.add(new RuleHit(hit, rule, ruleIndex, depth, out.size()));
        }
      }
    }
    for (Token token : siblings) {
      List<Token> nested = token.nested();
      if (nested != null) {
        apply(nested, source, depth + 1, out);
      }
    }
  }

  /**
   * Apply the rules to a token tree and return only the matched tokens. This is
   * for consumers that want to find structure in the tree without painting it.
   *
   * @param tokens The root sibling list of the tree.
   * @param source The buffer the tree was parsed from.
   *
   * @return The matched tokens, in emission order. A token matched by several
   *         matchers appears once per match.
   */
  public List<Token> query(List<Token> tokens, String source) {
    List<RuleHit> hits = apply(tokens, source);
    List<Token> matched = new ArrayList<>(hits.size());
    for (RuleHit hit : hits) {
      matched.add(hit.hit.token);
    }
    return matched;
  }

  /** @return The number of rules in this set. */
  public int size() {
    return rules.size();
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    StringBuilder b = new StringBuilder();
    for (Rule rule : rules) {
      b.append(rule).append('\n');
    }
    return b.toString();
  }
}

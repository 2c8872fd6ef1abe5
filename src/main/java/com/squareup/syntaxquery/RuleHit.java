package com.squareup.syntaxquery;

/**
 * <p>
 *   A {@link Hit} made while applying a {@link RuleSet} to a token tree, together
 *   with what's needed to order it: the rule it came from, the depth of the
 *   sibling list the rule was scanned over, and its emission index.
 * </p>
 *
 * <p>
 *   Hits made inside a <code>contains</code> sequence carry the depth of the scan
 *   that reached them, not the depth of their own token. A rule resetting the style
 *   of a nested token is on the same footing as the rule that styled its parent,
 *   and below anything the rules find further down the tree.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class RuleHit {

  /**
   * The factor separating declared priorities from the depth adjustment. Any
   * difference in declared priority outweighs any difference in depth up to this
   * bound; deeper lists are clamped to it.
   */
  public static final int DEPTH_SCALE = 1024;

  /** The underlying matcher + token pair. */
  public final Hit hit;
  /** The rule that made this hit. */
  public final Rule rule;
  /** The index of {@link #rule} in its rule set. */
  public final int ruleIndex;
  /** The depth of the sibling list the rule was scanned over. The root list is depth 0. */
  public final int depth;
  /** The index of this hit among all hits of a single application of a rule set. */
  public final int order;

  /** The straightforward constructor. */
  RuleHit(Hit hit, Rule rule, int ruleIndex, int depth, int order) {
    this.hit = hit;
    this.rule = rule;
    this.ruleIndex = ruleIndex;
    this.depth = depth;
    this.order = order;
  }

  /**
   * <p>
   *   The priority this hit paints with:
   *   <code>declaredPriority * DEPTH_SCALE + min(depth, DEPTH_SCALE - 1)</code>.
   * </p>
   *
   * <p>
   *   Higher priorities paint later, and therefore on top. Within one declared
   *   priority, hits from deeper scans paint last, so that what was found inside a
   *   token shows through the context painted over the token. For example, a
   *   command inside a substitution stays a command even though the substitution
   *   itself was reset to the normal style.
   * </p>
   *
   * @return The effective priority of this hit.
   */
  public long effectivePriority() {
    return (long) rule.priority * DEPTH_SCALE + Math.min(depth, DEPTH_SCALE - 1);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return hit + " (rule " + ruleIndex + ", depth " + depth + ", #" + order + ")";
  }
}

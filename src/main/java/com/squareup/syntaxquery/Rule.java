package com.squareup.syntaxquery;

import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * <p>
 *   A highlighting rule: an ordered sequence of {@link TokenMatcher}s, scanned
 *   across each sibling list of the token tree, along with a declared priority.
 *   Rules with a higher priority paint over rules with a lower priority.
 * </p>
 *
 * <p>
 *   A typical rule in the rule language looks like
 * </p>
 *
 * <blockquote><pre>
 * rule strings: [kind:/Dnull|Snull/ hl:string] [!kind:/Dnull|Snull/ hl:string]* [kind:/Dnull|Snull/ hl:string]?;
 * </pre></blockquote>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Rule {

  /** The default priority of a rule. */
  public static final int DEFAULT_PRIORITY = 0;

  /** The name of this rule, for debugging. This may be null for anonymous rules. */
  @Nullable public final String name;
  /** The matchers making up this rule, in order. This is never empty. */
  public final List<TokenMatcher> sequence;
  /** The declared priority of this rule. See {@link #DEFAULT_PRIORITY}. */
  public final int priority;

  /**
   * Create a new rule.
   *
   * @param name See {@link #name}.
   * @param sequence See {@link #sequence}.
   * @param priority See {@link #priority}.
   *
   * @throws IllegalArgumentException Thrown if the sequence is empty.
   */
  public Rule(@Nullable String name, List<TokenMatcher> sequence, int priority) {
    if (sequence.isEmpty()) {
      throw new IllegalArgumentException("A rule must have at least one matcher");
    }
    this.name = name;
    this.sequence = List.copyOf(sequence);
    this.priority = priority;
  }

  /** Create an anonymous rule with the {@linkplain #DEFAULT_PRIORITY default priority}. */
  public Rule(List<TokenMatcher> sequence) {
    this(null, sequence, DEFAULT_PRIORITY);
  }

  /** Create an anonymous rule with the {@linkplain #DEFAULT_PRIORITY default priority}. */
  public static Rule of(TokenMatcher... sequence) {
    return new Rule(List.of(sequence));
  }

  /**
   * Scan this rule across a single sibling list.
   *
   * @see SequenceMatcher#scan(List, List, String)
   */
  public List<SequenceMatch> scan(List<Token> siblings, String source) {
    return SequenceMatcher.scan(sequence, siblings, source);
  }

  /**
   * <p>
   *   Visit each matcher of this rule, in depth-first order. Matchers nested in a
   *   <code>contains</code> sequence are visited before the matcher containing them.
   * </p>
   *
   * @param fn The function called for each matcher visited.
   */
  void forEachMatcher(Consumer<TokenMatcher> fn) {
    forEachMatcher(sequence, fn);
  }

  /** @see #forEachMatcher(Consumer) */
  private static void forEachMatcher(List<TokenMatcher> sequence, Consumer<TokenMatcher> fn) {
    for (TokenMatcher matcher : sequence) {
      if (matcher.contains != null) {
        forEachMatcher(matcher.contains, fn);
      }
      fn.accept(matcher);
    }
  }

  /** Write a sequence of matchers in the rule language. */
  static String toString(List<TokenMatcher> sequence) {
    StringBuilder b = new StringBuilder();
    for (int i = 0; i < sequence.size(); ++i) {
      if (i != 0) {
        b.append(' ');
      }
      b.append(sequence.get(i).toString());
    }
    return b.toString();
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    StringBuilder b = new StringBuilder("rule ");
    if (name != null) {
      b.append(name).append(": ");
    }
    if (priority != DEFAULT_PRIORITY) {
      b.append('@').append(priority).append(' ');
    }
    b.append(toString(sequence)).append(';');
    return b.toString();
  }
}

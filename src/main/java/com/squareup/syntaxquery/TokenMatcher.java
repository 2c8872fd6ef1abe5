package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;

/**
 * <p>
 *   One element of a {@link Rule}: a predicate over a single token, an optional
 *   highlight instruction, and a {@link Quantifier}. This is the analogue of a
 *   single bracketed token, e.g. <code>[kind:/STRING/ hl:command]+</code>, in
 *   the rule language compiled by {@link RuleCompiler}.
 * </p>
 *
 * <p>
 *   Every field is optional. A matcher with no predicates at all is a wildcard,
 *   and accepts any token. All regular expressions are compiled when the matcher
 *   is built, so that a malformed rule fails at load time rather than while
 *   matching.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class TokenMatcher {

  /** If set, the token kind must be fully matched by this regex. */
  @Nullable public final Pattern kind;
  /** If set, the token kind must not be fully matched by this regex. */
  @Nullable public final Pattern notKind;
  /** If set, this regex must be found in the token's text. */
  @Nullable public final Pattern regex;
  /** If set, this regex must not be found in the token's text. */
  @Nullable public final Pattern notRegex;
  /**
   * If set, this sequence must consume all of the token's nested tokens.
   * A token without nested tokens never matches.
   */
  @Nullable public final List<TokenMatcher> contains;
  /** The name of the style to paint the matched token with, if any. */
  @Nullable public final String hl;
  /**
   * If set, only the parts of the token's text matched by this regex are
   * painted with {@link #hl}. If the regex has a capture group, only the
   * first group is painted.
   */
  @Nullable public final Pattern hlRegex;
  /** The quantifier for this element of the sequence. */
  public final Quantifier quantifier;

  /** Create a matcher from its builder. See {@link Builder#build()}. */
  private TokenMatcher(Builder builder) {
    this.kind = builder.kind;
    this.notKind = builder.notKind;
    this.regex = builder.regex;
    this.notRegex = builder.notRegex;
    this.contains = builder.contains == null ? null : List.copyOf(builder.contains);
    this.hl = builder.hl;
    this.hlRegex = builder.hlRegex;
    this.quantifier = builder.quantifier;
  }

  /**
   * <p>
   *   Check this matcher against a single token. This evaluates the kind and
   *   text predicates, and then, if {@link #contains} is set, runs the nested
   *   sequence over the token's nested tokens, requiring it to consume all of
   *   them.
   * </p>
   *
   * <p>
   *   The quantifier is not consulted here; it is the business of the
   *   {@link SequenceMatcher}.
   * </p>
   *
   * @param token The token to check.
   * @param source The buffer the token was parsed from.
   *
   * @return Null if the token does not match. Otherwise, the hit for this matcher
   *         followed by all of the hits from the nested sequence, in order.
   */
  @Nullable public List<Hit> evaluate(Token token, String source) {
    if (contains != null && !token.hasNested()) {
      return null;
    }
    if (kind != null && !kind.matcher(token.kind()).matches()) {
      return null;
    }
    if (notKind != null && notKind.matcher(token.kind()).matches()) {
      return null;
    }
    if (regex != null || notRegex != null) {
      String text = token.text(source);
      if (regex != null && !regex.matcher(text).find()) {
        return null;
      }
      if (notRegex != null && notRegex.matcher(text).find()) {
        return null;
      }
    }

    if (contains == null) {
      return List.of(new Hit(this, token));
    }
    List<Token> nested = token.nested();
    assert nested != null : "We checked for nested tokens above";
    SequenceMatch inner = SequenceMatcher.matchAt(contains, 0, nested, 0, source);
    if (inner == null || inner.end != nested.size()) {
      return null;
    }
    List<Hit> hits = new ArrayList<>(inner.hits.size() + 1);
    hits.add(new Hit(this, token));
    hits.addAll(inner.hits);
    return hits;
  }

  /** @return True if this matcher accepts any token, without any predicate. */
  public boolean isWildcard() {
    return kind == null && notKind == null && regex == null && notRegex == null
        && contains == null;
  }

  /**
   * Write this matcher in the rule language, without its quantifier.
   *
   * @param b The builder we're appending to.
   */
  void populateToString(StringBuilder b) {
    List<String> fields = new ArrayList<>();
    if (kind != null) { fields.add("kind:/" + kind.pattern() + "/"); }
    if (notKind != null) { fields.add("!kind:/" + notKind.pattern() + "/"); }
    if (regex != null) { fields.add("regex:/" + regex.pattern() + "/"); }
    if (notRegex != null) { fields.add("!regex:/" + notRegex.pattern() + "/"); }
    if (contains != null) { fields.add("contains:(" + Rule.toString(contains) + ")"); }
    if (hl != null) { fields.add("hl:" + hl); }
    if (hlRegex != null) { fields.add("hlregex:/" + hlRegex.pattern() + "/"); }
    b.append('[').append(String.join(" ", fields)).append(']');
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    if (quantifier.isAnchor()) {
      return quantifier.symbol;
    }
    StringBuilder b = new StringBuilder();
    populateToString(b);
    b.append(quantifier.symbol);
    return b.toString();
  }

  /** @return A new builder for a matcher. */
  public static Builder builder() {
    return new Builder();
  }

  /** @return A zero-width matcher for the start of a sibling list. */
  public static TokenMatcher start() {
    return builder().quantifier(Quantifier.START).build();
  }

  /** @return A zero-width matcher for the end of a sibling list. */
  public static TokenMatcher end() {
    return builder().quantifier(Quantifier.END).build();
  }

  /**
   * A builder for a {@link TokenMatcher}. The string-valued setters compile their
   * argument, and therefore throw a {@link PatternSyntaxException} on a malformed regex.
   */
  public static final class Builder {
    @Nullable private Pattern kind;
    @Nullable private Pattern notKind;
    @Nullable private Pattern regex;
    @Nullable private Pattern notRegex;
    @Nullable private List<TokenMatcher> contains;
    @Nullable private String hl;
    @Nullable private Pattern hlRegex;
    private Quantifier quantifier = Quantifier.ONE;

    private Builder() {}

    /** @see TokenMatcher#kind */
    public Builder kind(String regex) throws PatternSyntaxException {
      return kind(Pattern.compile(regex));
    }

    /** @see TokenMatcher#kind */
    public Builder kind(Pattern regex) {
      this.kind = regex;
      return this;
    }

    /** @see TokenMatcher#notKind */
    public Builder notKind(String regex) throws PatternSyntaxException {
      return notKind(Pattern.compile(regex));
    }

    /** @see TokenMatcher#notKind */
    public Builder notKind(Pattern regex) {
      this.notKind = regex;
      return this;
    }

    /** @see TokenMatcher#regex */
    public Builder regex(String regex) throws PatternSyntaxException {
      return regex(Pattern.compile(regex));
    }

    /** @see TokenMatcher#regex */
    public Builder regex(Pattern regex) {
      this.regex = regex;
      return this;
    }

    /** @see TokenMatcher#notRegex */
    public Builder notRegex(String regex) throws PatternSyntaxException {
      return notRegex(Pattern.compile(regex));
    }

    /** @see TokenMatcher#notRegex */
    public Builder notRegex(Pattern regex) {
      this.notRegex = regex;
      return this;
    }

    /** @see TokenMatcher#contains */
    public Builder contains(List<TokenMatcher> sequence) {
      this.contains = sequence;
      return this;
    }

    /** @see TokenMatcher#contains */
    public Builder contains(TokenMatcher... sequence) {
      return contains(List.of(sequence));
    }

    /** @see TokenMatcher#hl */
    public Builder hl(String style) {
      this.hl = style;
      return this;
    }

    /** @see TokenMatcher#hlRegex */
    public Builder hlRegex(String regex) throws PatternSyntaxException {
      return hlRegex(Pattern.compile(regex));
    }

    /** @see TokenMatcher#hlRegex */
    public Builder hlRegex(Pattern regex) {
      this.hlRegex = regex;
      return this;
    }

    /** @see TokenMatcher#quantifier */
    public Builder quantifier(Quantifier quantifier) {
      this.quantifier = quantifier;
      return this;
    }

    /**
     * Build the matcher, validating that the fields are consistent.
     *
     * @return The new matcher.
     *
     * @throws IllegalArgumentException Thrown if {@link #contains} was given an empty
     *         sequence, {@link #hlRegex} was set without {@link #hl}, or an anchor was
     *         given predicates or a style.
     */
    public TokenMatcher build() {
      if (contains != null && contains.isEmpty()) {
        throw new IllegalArgumentException("'contains' requires a non-empty nested sequence");
      }
      if (hlRegex != null && hl == null) {
        throw new IllegalArgumentException("'hlregex' requires a style to be set with 'hl'");
      }
      if (quantifier.isAnchor() && (kind != null || notKind != null || regex != null
          || notRegex != null || contains != null || hl != null)) {
        throw new IllegalArgumentException(
            "The anchor '" + quantifier.symbol + "' cannot carry predicates or a style");
      }
      return new TokenMatcher(this);
    }
  }
}

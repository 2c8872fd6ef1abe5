package com.squareup.syntaxquery;

import java.util.Objects;

/**
 * A single (matcher, token) pair: the record that a {@link TokenMatcher}
 * accepted a {@link Token} as part of a successful sequence match.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Hit {

  /** The matcher that accepted the token. */
  public final TokenMatcher matcher;
  /** The token that was accepted. */
  public final Token token;

  /** The straightforward constructor. */
  public Hit(TokenMatcher matcher, Token token) {
    this.matcher = matcher;
    this.token = token;
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Hit that = (Hit) o;
    return matcher == that.matcher && token.equals(that.token);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(System.identityHashCode(matcher), token);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return matcher + "@" + token;
  }
}

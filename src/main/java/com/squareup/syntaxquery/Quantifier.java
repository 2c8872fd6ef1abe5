package com.squareup.syntaxquery;

import javax.annotation.Nullable;

/**
 * <p>
 *   The quantifier on a single element of a {@link Rule}. These mirror the
 *   quantifiers of a character regular expression, but count tokens instead
 *   of characters. The anchors {@link #START} and {@link #END} are zero-width
 *   and never consume a token.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public enum Quantifier {
  /** Exactly one token. */
  ONE(""),
  /** Zero or one token, preferring one. */
  OPTIONAL("?"),
  /** Zero or one token, preferring zero. */
  OPTIONAL_RELUCTANT("??"),
  /** Any number of tokens, preferring more. */
  STAR("*"),
  /** Any number of tokens, preferring fewer. */
  STAR_RELUCTANT("*?"),
  /** At least one token, preferring more. */
  PLUS("+"),
  /** At least one token, preferring fewer. */
  PLUS_RELUCTANT("+?"),
  /** Matches only before the first sibling. */
  START("^"),
  /** Matches only after the last sibling. */
  END("$"),
  ;

  /** The suffix (or, for anchors, the symbol) used to write this quantifier. */
  public final String symbol;

  Quantifier(String symbol) {
    this.symbol = symbol;
  }

  /**
   * @return True if the element may match zero tokens, and so the
   *         sequence engine should first try skipping it.
   */
  boolean canSkip() {
    return this == OPTIONAL || this == OPTIONAL_RELUCTANT
        || this == STAR || this == STAR_RELUCTANT;
  }

  /** @return True if shorter matches are preferred over longer ones. */
  boolean isReluctant() {
    return this == OPTIONAL_RELUCTANT || this == STAR_RELUCTANT || this == PLUS_RELUCTANT;
  }

  /** @return True if this is one of the zero-width anchors. */
  public boolean isAnchor() {
    return this == START || this == END;
  }

  /**
   * Look up a quantifier by its written form.
   *
   * @param symbol The symbol; e.g., "*?" or "$". The empty string is {@link #ONE}.
   *
   * @return The quantifier, or null if the symbol is not a quantifier.
   */
  @Nullable public static Quantifier fromSymbol(String symbol) {
    for (Quantifier quantifier : values()) {
      if (quantifier.symbol.equals(symbol)) {
        return quantifier;
      }
    }
    return null;
  }
}

package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * <p>
 *   The backtracking engine aligning a sequence of {@link TokenMatcher}s against a
 *   run of sibling {@link Token}s. This is a regular expression matcher in the usual
 *   greedy / reluctant style, where the alphabet is tokens rather than characters.
 * </p>
 *
 * <p>
 *   Optional elements (<code>?</code>, <code>??</code>, <code>*</code>,
 *   <code>*?</code>) are handled by first trying to match the remainder of the
 *   sequence with the element skipped. A reluctant element takes that match as soon
 *   as it exists. A greedy element remembers it as a fallback and goes on to consume
 *   the current token; if anything later in the sequence fails, the fallback is
 *   returned instead of failing outright. Since every consumed token refreshes the
 *   fallback, the fallback is always the longest consumption for which the rest of
 *   the sequence matched.
 * </p>
 *
 * <p>
 *   The engine is a set of pure functions: no state survives a call, and the hits
 *   are returned rather than pushed to a callback.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class SequenceMatcher {

  /** Static methods only. */
  private SequenceMatcher() {}

  /**
   * Try to align <code>sequence[seqIndex..]</code> against
   * <code>siblings[tokenIndex..]</code>.
   *
   * @param sequence The sequence of matchers to align.
   * @param seqIndex The index of the first matcher to align.
   * @param siblings The sibling tokens we are matching against.
   * @param tokenIndex The index of the first sibling to match.
   * @param source The buffer the tokens were parsed from.
   *
   * @return The match, whose {@link SequenceMatch#end} is the index just past the last
   *         consumed token, or null if the sequence does not match here.
   */
  @Nullable public static SequenceMatch matchAt(
      List<TokenMatcher> sequence,
      int seqIndex,
      List<Token> siblings,
      int tokenIndex,
      String source) {
    final int begin = tokenIndex;
    List<Hit> hits = new ArrayList<>();
    @Nullable SequenceMatch fallback = null;
    Quantifier mod = seqIndex < sequence.size() ? sequence.get(seqIndex).quantifier : null;

    while (seqIndex < sequence.size()) {
      TokenMatcher matcher = sequence.get(seqIndex);

      if (mod.canSkip()) {
        // Try the rest of the sequence without this element
        SequenceMatch skipped = matchAt(sequence, seqIndex + 1, siblings, tokenIndex, source);
        if (skipped != null) {
          skipped = skipped.prependedWith(begin, hits);
          if (mod.isReluctant()) {
            return skipped;
          }
          fallback = skipped;
        }
      }

      boolean nextMatcher;
      if (mod == Quantifier.END) {
        if (tokenIndex < siblings.size()) {
          return fallback;
        }
        nextMatcher = true;
      } else if (mod == Quantifier.START) {
        if (tokenIndex != 0) {
          return fallback;
        }
        nextMatcher = true;
      } else if (tokenIndex >= siblings.size()) {
        // Ran out of tokens before the end of the sequence
        return fallback;
      } else {
        List<Hit> matched = matcher.evaluate(siblings.get(tokenIndex), source);
        if (matched != null) {
          hits.addAll(matched);
          tokenIndex += 1;
        }
        if (mod == Quantifier.STAR || mod == Quantifier.STAR_RELUCTANT) {
          nextMatcher = matched == null;
        } else if (mod == Quantifier.PLUS || mod == Quantifier.PLUS_RELUCTANT) {
          if (matched == null) {
            return fallback;
          }
          // One mandatory match is done; the rest is a star
          mod = mod.isReluctant() ? Quantifier.STAR_RELUCTANT : Quantifier.STAR;
          nextMatcher = false;
        } else if (matched != null) {
          nextMatcher = true;
        } else {
          return fallback;
        }
      }

      if (nextMatcher) {
        seqIndex += 1;
        mod = seqIndex < sequence.size() ? sequence.get(seqIndex).quantifier : null;
      }
    }
    return new SequenceMatch(begin, tokenIndex, hits);
  }

  /**
   * <p>
   *   Scan a sequence across a sibling list from left to right, collecting every
   *   non-overlapping match. After a match the scan continues at the match's end;
   *   after a failure it continues at the next token. A zero-width match is
   *   reported once and the scan then moves on by one token.
   * </p>
   *
   * @param sequence The sequence of matchers.
   * @param siblings The sibling tokens to scan.
   * @param source The buffer the tokens were parsed from.
   *
   * @return The matches, in the order found. This is empty if nothing matched.
   */
  public static List<SequenceMatch> scan(
      List<TokenMatcher> sequence,
      List<Token> siblings,
      String source) {
    List<SequenceMatch> matches = null;  // avoid needless object allocation
    int index = 0;
    while (index < siblings.size()) {
      SequenceMatch match = matchAt(sequence, 0, siblings, index, source);
      if (match != null) {
        if (matches == null) { matches = new ArrayList<>(); }
        matches.add(match);
        index = Math.max(match.end, index + 1);
      } else {
        index += 1;
      }
    }
    return matches == null ? Collections.emptyList() : matches;
  }
}

package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A successful match of a sequence against a run of sibling tokens: the
 * index just past the last consumed token, and the hits collected along the
 * way, in order.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class SequenceMatch {

  /** The index of the first sibling this match began at, inclusive. */
  public final int begin;
  /** The index just past the last consumed sibling, exclusive. */
  public final int end;
  /** The hits collected by the match, in the order they were made. */
  public final List<Hit> hits;

  /**
   * Create a match.
   *
   * @param begin See {@link #begin}.
   * @param end See {@link #end}.
   * @param hits See {@link #hits}.
   */
  SequenceMatch(int begin, int end, List<Hit> hits) {
    this.begin = begin;
    this.end = end;
    this.hits = Collections.unmodifiableList(hits);
  }

  /**
   * Create a copy of this match, with the given hits placed in front of our own
   * and the begin index moved back. This is used when the remainder of a sequence
   * matched from a later element, and we need to stitch on what came before it.
   *
   * @param begin The new begin index.
   * @param prefix The hits made before the remainder matched.
   *
   * @return A new match.
   */
  SequenceMatch prependedWith(int begin, List<Hit> prefix) {
    if (prefix.isEmpty() && begin == this.begin) {
      return this;
    }
    List<Hit> combined = new ArrayList<>(prefix.size() + hits.size());
    combined.addAll(prefix);
    combined.addAll(hits);
    return new SequenceMatch(begin, end, combined);
  }

  /** @return The number of sibling tokens consumed by this match. */
  public int length() {
    return end - begin;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "[" + begin + "," + end + ")" + hits;
  }
}

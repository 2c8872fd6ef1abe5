package com.squareup.syntaxquery;

import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * <p>
 *   A single node of the token tree produced by parsing a command buffer.
 *   A token covers the half-open range [{@link #start()}, {@link #finish()})
 *   of the buffer, carries the parser's kind tag, and may contain an ordered
 *   list of nested tokens (e.g., the pieces of a quoted string, or the command
 *   inside a substitution).
 * </p>
 *
 * <p>
 *   Offsets are indices into the Java {@link String} holding the buffer.
 *   Tokens are immutable and are never copied while matching.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Token {

  /** The start of the token in the buffer, inclusive. */
  private final int start;
  /** The end of the token in the buffer, exclusive. */
  private final int finish;
  /** The kind of this token, as reported by the parser. Never null. */
  private final String kind;
  /**
   * The nested tokens, ordered by start offset. This is null if the
   * parser did not produce any nested structure for this token.
   */
  @Nullable private final List<Token> nested;

  /**
   * Create a new token.
   *
   * @param start See {@link #start}.
   * @param finish See {@link #finish}.
   * @param kind See {@link #kind}. A null kind is stored as the empty string.
   * @param nested See {@link #nested}.
   *
   * @throws IllegalArgumentException Thrown if the range is inverted, or a nested
   *         token lies outside of this token or out of order.
   */
  public Token(int start, int finish, @Nullable String kind, @Nullable List<Token> nested) {
    if (start < 0 || finish < start) {
      throw new IllegalArgumentException("Invalid token range [" + start + "," + finish + ")");
    }
    this.start = start;
    this.finish = finish;
    this.kind = kind == null ? "" : kind;
    if (nested != null) {
      int previousStart = start;
      for (Token child : nested) {
        if (child.start < start || child.finish > finish) {
          throw new IllegalArgumentException("Nested token " + child
              + " lies outside of its parent " + this.kind + "[" + start + "," + finish + ")");
        }
        if (child.start < previousStart) {
          throw new IllegalArgumentException("Nested tokens must be ordered by start: " + nested);
        }
        previousStart = child.start;
      }
      this.nested = List.copyOf(nested);
    } else {
      this.nested = null;
    }
  }

  /** Create a token with no nested tokens. */
  public Token(int start, int finish, @Nullable String kind) {
    this(start, finish, kind, null);
  }

  /** @return The start offset of this token, inclusive. */
  public int start() {
    return start;
  }

  /** @return The end offset of this token, exclusive. */
  public int finish() {
    return finish;
  }

  /** @return The kind of this token; the empty string if the parser gave none. */
  public String kind() {
    return kind;
  }

  /** @return The nested tokens, or null if this token has no nested structure. */
  @Nullable public List<Token> nested() {
    return nested;
  }

  /** @return True if this token has at least one nested token. */
  public boolean hasNested() {
    return nested != null && !nested.isEmpty();
  }

  /**
   * Get the text this token covers.
   *
   * @param source The buffer this token was parsed from.
   *
   * @return The substring of the buffer this token spans.
   */
  public String text(String source) {
    return source.substring(start, finish);
  }

  /**
   * Render a token tree for debugging, as a nested list of
   * <code>["text", kind, [...nested]]</code> entries.
   *
   * @param tokens The sibling tokens to render.
   * @param source The buffer the tokens were parsed from.
   *
   * @return A human-readable rendering of the tree.
   */
  public static String debugString(List<Token> tokens, String source) {
    StringBuilder b = new StringBuilder();
    appendDebugString(b, tokens, source);
    return b.toString();
  }

  /** The recursive implementation of {@link #debugString(List, String)}. */
  private static void appendDebugString(StringBuilder b, List<Token> tokens, String source) {
    b.append('[');
    for (int i = 0; i < tokens.size(); ++i) {
      if (i != 0) {
        b.append(", ");
      }
      Token token = tokens.get(i);
      b.append('[')
          .append('"')
          .append(token.text(source).replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"')
          .append(", ")
          .append(token.kind);
      if (token.nested != null) {
        b.append(", ");
        appendDebugString(b, token.nested, source);
      }
      b.append(']');
    }
    b.append(']');
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Token that = (Token) o;
    return start == that.start &&
        finish == that.finish &&
        kind.equals(that.kind) &&
        Objects.equals(nested, that.nested);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(start, finish, kind, nested);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return kind + "[" + start + "," + finish + ")";
  }
}

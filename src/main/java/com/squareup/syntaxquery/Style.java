package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * <p>
 *   A set of terminal text attributes. Every attribute is optional: an unset
 *   attribute leaves whatever was painted underneath alone. A set attribute
 *   overrides it, and the "off" value of a toggle (or {@link Color#RESET} for a
 *   colour) explicitly resets it to the terminal default.
 * </p>
 *
 * <p>
 *   The matching engine never looks inside a style; only a
 *   {@link HighlightRenderer} does.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Style {

  /** A style with no attributes set. */
  public static final Style EMPTY = builder().build();

  @Nullable public final Color fg;
  @Nullable public final Color bg;
  @Nullable public final Boolean bold;
  @Nullable public final Boolean dim;
  @Nullable public final Boolean italic;
  @Nullable public final Boolean underline;
  @Nullable public final Boolean strikethrough;
  @Nullable public final Boolean reversed;
  @Nullable public final Boolean blink;

  /** Create a style from its builder. */
  private Style(Builder builder) {
    this.fg = builder.fg;
    this.bg = builder.bg;
    this.bold = builder.bold;
    this.dim = builder.dim;
    this.italic = builder.italic;
    this.underline = builder.underline;
    this.strikethrough = builder.strikethrough;
    this.reversed = builder.reversed;
    this.blink = builder.blink;
  }

  /** @return A builder for a new style. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return A style resetting every attribute to the terminal default. This is
   *         the <code>normal</code> style, used to undo an outer highlight.
   */
  public static Style reset() {
    return builder()
        .fg(Color.RESET).bg(Color.RESET)
        .bold(false).dim(false).italic(false).underline(false)
        .strikethrough(false).reversed(false).blink(false)
        .build();
  }

  /** @return A builder initialized with the attributes of this style. */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.fg = fg;
    b.bg = bg;
    b.bold = bold;
    b.dim = dim;
    b.italic = italic;
    b.underline = underline;
    b.strikethrough = strikethrough;
    b.reversed = reversed;
    b.blink = blink;
    return b;
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Style that = (Style) o;
    return Objects.equals(fg, that.fg) &&
        Objects.equals(bg, that.bg) &&
        Objects.equals(bold, that.bold) &&
        Objects.equals(dim, that.dim) &&
        Objects.equals(italic, that.italic) &&
        Objects.equals(underline, that.underline) &&
        Objects.equals(strikethrough, that.strikethrough) &&
        Objects.equals(reversed, that.reversed) &&
        Objects.equals(blink, that.blink);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(fg, bg, bold, dim, italic, underline, strikethrough, reversed, blink);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    List<String> attributes = new ArrayList<>();
    if (fg != null) { attributes.add("fg: " + fg); }
    if (bg != null) { attributes.add("bg: " + bg); }
    if (bold != null) { attributes.add("bold: " + bold); }
    if (dim != null) { attributes.add("dim: " + dim); }
    if (italic != null) { attributes.add("italic: " + italic); }
    if (underline != null) { attributes.add("underline: " + underline); }
    if (strikethrough != null) { attributes.add("strikethrough: " + strikethrough); }
    if (reversed != null) { attributes.add("reversed: " + reversed); }
    if (blink != null) { attributes.add("blink: " + blink); }
    return "{ " + String.join("; ", attributes) + (attributes.isEmpty() ? "}" : "; }");
  }

  /** A builder for a {@link Style}. */
  public static final class Builder {
    @Nullable private Color fg;
    @Nullable private Color bg;
    @Nullable private Boolean bold;
    @Nullable private Boolean dim;
    @Nullable private Boolean italic;
    @Nullable private Boolean underline;
    @Nullable private Boolean strikethrough;
    @Nullable private Boolean reversed;
    @Nullable private Boolean blink;

    private Builder() {}

    public Builder fg(@Nullable Color fg) { this.fg = fg; return this; }
    public Builder bg(@Nullable Color bg) { this.bg = bg; return this; }
    public Builder bold(@Nullable Boolean bold) { this.bold = bold; return this; }
    public Builder dim(@Nullable Boolean dim) { this.dim = dim; return this; }
    public Builder italic(@Nullable Boolean italic) { this.italic = italic; return this; }
    public Builder underline(@Nullable Boolean underline) { this.underline = underline; return this; }
    public Builder strikethrough(@Nullable Boolean strikethrough) { this.strikethrough = strikethrough; return this; }
    public Builder reversed(@Nullable Boolean reversed) { this.reversed = reversed; return this; }
    public Builder blink(@Nullable Boolean blink) { this.blink = blink; return this; }

    /**
     * Set an attribute by the name used in the rule language. Colours are
     * parsed with {@link Color#parse(String)}; toggles accept
     * <code>true</code> or <code>false</code>.
     *
     * @param attribute The attribute name; e.g., <code>fg</code> or <code>bold</code>.
     * @param value The value, as written.
     *
     * @return This builder.
     *
     * @throws IllegalArgumentException Thrown if the attribute or value is invalid.
     */
    public Builder set(String attribute, String value) {
      switch (attribute) {
        case "fg":
          return fg(Color.parse(value));
        case "bg":
          return bg(Color.parse(value));
        case "bold":
          return bold(parseToggle(attribute, value));
        case "dim":
          return dim(parseToggle(attribute, value));
        case "italic":
          return italic(parseToggle(attribute, value));
        case "underline":
          return underline(parseToggle(attribute, value));
        case "strikethrough":
          return strikethrough(parseToggle(attribute, value));
        case "reversed":
          return reversed(parseToggle(attribute, value));
        case "blink":
          return blink(parseToggle(attribute, value));
        default:
          throw new IllegalArgumentException("Unknown style attribute: '" + attribute + "'");
      }
    }

    /** Parse a boolean attribute, strictly. */
    private static boolean parseToggle(String attribute, String value) {
      if ("true".equals(value)) {
        return true;
      } else if ("false".equals(value)) {
        return false;
      } else {
        throw new IllegalArgumentException(
            "Attribute '" + attribute + "' must be true or false, not '" + value + "'");
      }
    }

    /** @return The new style. */
    public Style build() {
      return new Style(this);
    }
  }
}

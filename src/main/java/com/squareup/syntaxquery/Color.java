package com.squareup.syntaxquery;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <p>
 *   A terminal colour, for the foreground or background of a {@link Style}.
 *   This is one of: one of the sixteen named ANSI colours, a 24-bit RGB colour,
 *   or the {@link #RESET} sentinel for the terminal's default colour.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Color {

  /** The kinds of colour we can represent. */
  public enum Kind {
    RESET,
    INDEXED,
    RGB
  }

  /** The names of the sixteen ANSI colours, mapped to their palette index. */
  private static final Map<String, Integer> NAMED = Map.ofEntries(
      Map.entry("black", 0),
      Map.entry("red", 1),
      Map.entry("green", 2),
      Map.entry("yellow", 3),
      Map.entry("blue", 4),
      Map.entry("magenta", 5),
      Map.entry("cyan", 6),
      Map.entry("gray", 7),
      Map.entry("grey", 7),
      Map.entry("darkgray", 8),
      Map.entry("darkgrey", 8),
      Map.entry("lightred", 9),
      Map.entry("lightgreen", 10),
      Map.entry("lightyellow", 11),
      Map.entry("lightblue", 12),
      Map.entry("lightmagenta", 13),
      Map.entry("lightcyan", 14),
      Map.entry("white", 15)
  );

  /** The terminal's default colour. */
  public static final Color RESET = new Color(Kind.RESET, -1);

  /** The kind of this colour. */
  public final Kind kind;
  /**
   * The value of this colour: the palette index for {@link Kind#INDEXED},
   * the <code>0xRRGGBB</code> value for {@link Kind#RGB}, and -1 for {@link Kind#RESET}.
   */
  public final int value;

  /** The straightforward constructor. */
  private Color(Kind kind, int value) {
    this.kind = kind;
    this.value = value;
  }

  /** @return The ANSI palette colour at the given index, 0 through 15. */
  public static Color indexed(int index) {
    if (index < 0 || index > 15) {
      throw new IllegalArgumentException("ANSI colour index out of range: " + index);
    }
    return new Color(Kind.INDEXED, index);
  }

  /** @return The 24-bit colour with the given <code>0xRRGGBB</code> value. */
  public static Color rgb(int rgb) {
    return new Color(Kind.RGB, rgb & 0xFFFFFF);
  }

  /**
   * Parse a colour from its name: <code>reset</code>, one of the ANSI colour names
   * (e.g., <code>red</code>, <code>lightblue</code>), or a hex value like
   * <code>#ffaaaa</code>. Names are case insensitive.
   *
   * @param spec The colour to parse.
   *
   * @return The parsed colour.
   *
   * @throws IllegalArgumentException Thrown if this is not a known colour.
   */
  public static Color parse(String spec) {
    String name = spec.trim().toLowerCase(Locale.ROOT);
    if ("reset".equals(name)) {
      return RESET;
    }
    if (name.matches("#[0-9a-f]{6}")) {
      return rgb(Integer.parseInt(name.substring(1), 16));
    }
    Integer index = NAMED.get(name);
    if (index == null) {
      throw new IllegalArgumentException("Unknown colour: '" + spec + "'");
    }
    return indexed(index);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Color that = (Color) o;
    return kind == that.kind && value == that.value;
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(kind, value);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    switch (kind) {
      case RESET:
        return "reset";
      case RGB:
        return String.format("#%06x", value);
      default:
        return "ansi(" + value + ")";
    }
  }
}

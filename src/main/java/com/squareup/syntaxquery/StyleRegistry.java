package com.squareup.syntaxquery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * <p>
 *   The static mapping from style names, as used by the <code>hl</code> field of
 *   a {@link TokenMatcher}, to {@link Style}s. A registry is immutable once built;
 *   use {@link #with(String, Style)} or {@link #merge(StyleRegistry)} to derive a new one.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class StyleRegistry {

  /** The registry with no styles at all. */
  private static final StyleRegistry EMPTY = new StyleRegistry(Collections.emptyMap());

  /** The styles, in registration order. */
  private final Map<String, Style> styles;

  /**
   * Create a registry from a map of styles.
   *
   * @param styles The styles, keyed by name.
   */
  public StyleRegistry(Map<String, Style> styles) {
    this.styles = Collections.unmodifiableMap(new LinkedHashMap<>(styles));
  }

  /** @return A registry with no styles. */
  public static StyleRegistry empty() {
    return EMPTY;
  }

  /**
   * The default palette for a command line: strings, flags, commands, keywords,
   * variables, comments, heredoc tags, errors, and the <code>normal</code> style
   * resetting everything.
   *
   * @return The default registry.
   */
  public static StyleRegistry defaults() {
    Map<String, Style> styles = new LinkedHashMap<>();
    styles.put("normal", Style.reset());
    styles.put("flag", Style.builder().fg(Color.parse("#ffaaaa")).build());
    styles.put("escape", Style.builder().fg(Color.parse("#ffaaaa")).build());
    styles.put("escape_space",
        Style.builder().fg(Color.parse("#ffaaaa")).bg(Color.parse("#442222")).build());
    styles.put("string",
        Style.builder().fg(Color.parse("#ffffaa")).bg(Color.parse("#333300")).build());
    styles.put("heredoc_tag", Style.builder().fg(Color.parse("lightblue")).bold(true).build());
    styles.put("variable", Style.builder().fg(Color.parse("lightmagenta")).build());
    styles.put("command", Style.builder().fg(Color.parse("#aaffaa")).bold(true).build());
    styles.put("func", Style.builder().fg(Color.parse("yellow")).build());
    styles.put("keyword", Style.builder().fg(Color.parse("red")).build());
    styles.put("punctuation", Style.builder().fg(Color.parse("cyan")).build());
    styles.put("comment", Style.builder().fg(Color.parse("grey")).build());
    styles.put("env_var_key", Style.builder().fg(Color.parse("#aa77ff")).build());
    styles.put("env_var_value", Style.builder().fg(Color.parse("#77aaff")).build());
    styles.put("error", Style.builder().bg(Color.parse("red")).build());
    return new StyleRegistry(styles);
  }

  /**
   * Look up a style by name.
   *
   * @param name The name of the style.
   *
   * @return The style, or null if no style is registered with that name.
   */
  @Nullable public Style get(String name) {
    return styles.get(name);
  }

  /** @return True if a style is registered with the given name. */
  public boolean contains(String name) {
    return styles.containsKey(name);
  }

  /** @return The names of all registered styles, in registration order. */
  public Set<String> names() {
    return styles.keySet();
  }

  /**
   * @return A new registry with the given style added, replacing any style
   *         already registered under that name.
   */
  public StyleRegistry with(String name, Style style) {
    Map<String, Style> copy = new LinkedHashMap<>(styles);
    copy.put(name, style);
    return new StyleRegistry(copy);
  }

  /**
   * @return A new registry with all of the styles in this registry and the argument.
   *         Styles in the argument win over styles of the same name in this registry.
   */
  public StyleRegistry merge(StyleRegistry other) {
    Map<String, Style> copy = new LinkedHashMap<>(styles);
    copy.putAll(other.styles);
    return new StyleRegistry(copy);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return styles.toString();
  }
}

package com.squareup.syntaxquery;

import static com.squareup.syntaxquery.rules.HighlightRulesParser.*;

import com.squareup.syntaxquery.rules.HighlightRulesBaseVisitor;
import com.squareup.syntaxquery.rules.HighlightRulesLexer;
import com.squareup.syntaxquery.rules.HighlightRulesParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   An error listener which turns the first lexer or parser error into a
 *   {@link PatternSyntaxException}, rather than letting Antlr log it and
 *   recover.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
class ThrowingErrorListener extends BaseErrorListener {

  /** The text we are parsing, for the exception. */
  private final String originalText;

  ThrowingErrorListener(String originalText) {
    this.originalText = originalText;
  }

  /** {@inheritDoc} */
  @Override public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
      int line, int charPositionInLine, String msg, RecognitionException e) {
    int index;
    if (offendingSymbol instanceof org.antlr.v4.runtime.Token) {
      index = ((org.antlr.v4.runtime.Token) offendingSymbol).getStartIndex();
    } else {
      index = recognizer.getInputStream().index();
    }
    throw new PatternSyntaxException(
        "Syntax error at line " + line + ":" + charPositionInLine + ": " + msg,
        originalText,
        index);
  }
}

/**
 * <p>
 *   The Antlr visitor for a single element of a rule: an anchor, or a bracketed
 *   matcher with its quantifier. Nested <code>contains:(...)</code> sequences
 *   are visited recursively with this same visitor.
 * </p>
 *
 * <p>
 *   Style names are not resolved here, since a style may be declared after the
 *   rule using it. Every <code>hl</code> field is recorded in
 *   {@link #styleReferences} instead, and checked once the whole file is read.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
class ElementVisitor extends HighlightRulesBaseVisitor<TokenMatcher> {

  /**
   * The rules we are visiting, as originally input.
   * This will not have whitespace and comments stripped.
   */
  private final String originalText;
  /**
   * The parser instance, used for debugging output / exceptions.
   */
  private final HighlightRulesParser parser;
  /**
   * Every <code>hl:name</code> field we've seen, for checking against the style registry.
   */
  final List<Name_fieldContext> styleReferences = new ArrayList<>();

  ElementVisitor(String originalText, HighlightRulesParser parser) {
    this.originalText = originalText;
    this.parser = parser;
  }

  /**
   * Generate a human-readable exception for what went wrong when
   * compiling our rules.
   */
  private PatternSyntaxException mkException(
      ParserRuleContext ctx,
      String cause) {
    return RuleCompiler.mkException(ctx, cause, originalText, parser);
  }

  /**
   * Visit a list of elements, as found in a rule or a <code>contains</code> field.
   *
   * @param elements The elements to visit.
   *
   * @return The compiled matchers, in order.
   */
  List<TokenMatcher> visitSequence(List<ElementContext> elements) {
    List<TokenMatcher> sequence = new ArrayList<>(elements.size());
    for (ElementContext element : elements) {
      sequence.add(element.accept(this));
    }
    return sequence;
  }

  /** {@inheritDoc} */
  @Override public TokenMatcher visitStart_element(Start_elementContext ctx) {
    return TokenMatcher.start();
  }

  /** {@inheritDoc} */
  @Override public TokenMatcher visitEnd_element(End_elementContext ctx) {
    return TokenMatcher.end();
  }

  /** {@inheritDoc} */
  @Override public TokenMatcher visitMatcher_element(Matcher_elementContext ctx) {
    TokenMatcher.Builder builder = TokenMatcher.builder();
    Set<String> seenKeys = new HashSet<>();
    for (FieldContext field : ctx.matcher().field()) {
      String key = fieldKey(field);
      if (!seenKeys.add(key)) {
        throw mkException(field, "Duplicate key '" + key + "'");
      }
      if (field instanceof Regex_fieldContext) {
        populateRegexField((Regex_fieldContext) field, builder);
      } else if (field instanceof Name_fieldContext) {
        Name_fieldContext nameField = (Name_fieldContext) field;
        if (!"hl".equals(key)) {
          throw mkException(field, "Key '" + key + "' does not take a name; expected a /regex/");
        }
        builder.hl(nameField.name(1).getText());
        styleReferences.add(nameField);
      } else if (field instanceof Contains_fieldContext) {
        Contains_fieldContext containsField = (Contains_fieldContext) field;
        if (!"contains".equals(key)) {
          throw mkException(field, "Only 'contains' takes a nested sequence, not '" + key + "'");
        }
        if (containsField.element().isEmpty()) {
          throw mkException(field, "'contains' requires a non-empty nested sequence");
        }
        builder.contains(visitSequence(containsField.element()));
      } else {
        throw mkException(field, "Unknown field type");
      }
    }
    if (seenKeys.contains("hlregex") && !seenKeys.contains("hl")) {
      throw mkException(ctx, "'hlregex' requires a style to be set with 'hl'");
    }
    if (ctx.quantifier() != null) {
      // Whitespace is skipped by the lexer, so the text is the bare symbol
      Quantifier quantifier = Quantifier.fromSymbol(ctx.quantifier().getText());
      if (quantifier == null) {
        throw mkException(ctx.quantifier(), "Unknown quantifier");
      }
      builder.quantifier(quantifier);
    }
    return builder.build();
  }

  /** Set a regex-valued field on a matcher builder. */
  private void populateRegexField(Regex_fieldContext field, TokenMatcher.Builder builder) {
    String key = field.name().getText();
    boolean negated = field.Bang() != null;
    String text = field.RegexLiteral().getText();
    Pattern regex = Pattern.compile(text.substring(1, text.length() - 1));
    switch (key) {
      case "kind":
        if (negated) {
          builder.notKind(regex);
        } else {
          builder.kind(regex);
        }
        break;
      case "regex":
        if (negated) {
          builder.notRegex(regex);
        } else {
          builder.regex(regex);
        }
        break;
      case "hlregex":
        if (negated) {
          throw mkException(field, "'hlregex' cannot be negated");
        }
        builder.hlRegex(regex);
        break;
      default:
        throw mkException(field, "Unknown key '" + key + "'");
    }
  }

  /** @return The key of a field, with its negation if any, e.g., <code>!kind</code>. */
  private static String fieldKey(FieldContext field) {
    if (field instanceof Regex_fieldContext) {
      Regex_fieldContext regexField = (Regex_fieldContext) field;
      return (regexField.Bang() == null ? "" : "!") + regexField.name().getText();
    } else if (field instanceof Name_fieldContext) {
      return ((Name_fieldContext) field).name(0).getText();
    } else {
      return ((Contains_fieldContext) field).name().getText();
    }
  }
}

/**
 * The Antlr visitor for a <code>style name { ... }</code> declaration.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
class StyleVisitor extends HighlightRulesBaseVisitor<Style> {

  /**
   * The rules we are visiting, as originally input.
   */
  private final String originalText;
  /**
   * The parser instance, used for debugging output / exceptions.
   */
  private final HighlightRulesParser parser;

  StyleVisitor(String originalText, HighlightRulesParser parser) {
    this.originalText = originalText;
    this.parser = parser;
  }

  /** {@inheritDoc} */
  @Override public Style visitStyle_decl(Style_declContext ctx) {
    Style.Builder builder = Style.builder();
    Set<String> seenAttributes = new HashSet<>();
    for (Style_attrContext attr : ctx.style_attr()) {
      String attribute = attr.name().getText();
      if (!seenAttributes.add(attribute)) {
        throw RuleCompiler.mkException(attr, "Duplicate style attribute '" + attribute + "'",
            originalText, parser);
      }
      try {
        builder.set(attribute, attr.style_value().getText());
      } catch (IllegalArgumentException e) {
        throw RuleCompiler.mkException(attr, e.getMessage(), originalText, parser);
      }
    }
    return builder.build();
  }
}

/**
 * <p>
 *   Compiles a highlight rule file into a {@link RuleSet}, analogous to
 *   {@link Pattern#compile(String)}. A rule file is a list of style declarations
 *   and rules:
 * </p>
 *
 * <pre>
 * # Strings, with substitutions inside them reset to normal
 * style string { fg: #ffffaa; bg: #333300; }
 * rule [kind:/STRING/ hl:string];
 * rule [kind:/STRING/ contains:([kind:/substitution/ hl:normal] []*)];
 *
 * # Flags, highlighting only the part before the '='
 * rule flags: @5 [regex:/^-/ hl:flag hlregex:/^-[^=]+/];
 * </pre>
 *
 * <p>
 *   Each matcher is a bracketed list of <code>key:value</code> fields:
 *   <code>kind</code> and <code>regex</code> (negatable with a leading
 *   <code>!</code>), <code>hlregex</code>, <code>hl</code> and
 *   <code>contains</code>. The empty matcher <code>[]</code> matches any token.
 *   Matchers take the quantifiers <code>?</code>, <code>*</code> and
 *   <code>+</code>, each with a reluctant <code>?</code> variant; <code>^</code>
 *   and <code>$</code> anchor a rule to the start and end of a sibling list.
 * </p>
 *
 * <p>
 *   Declared styles are merged over a base registry, by default
 *   {@link StyleRegistry#defaults()}, so a file can restyle the built-in
 *   names as well as add its own.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class RuleCompiler {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

  /** The classpath resource holding the default rules. */
  public static final String DEFAULT_RESOURCE = "default.hlrules";

  /** Static methods only. */
  private RuleCompiler() {}

  /**
   * Generate a human-readable exception for what went wrong when
   * compiling a rule file.
   */
  static PatternSyntaxException mkException(
      ParserRuleContext ctx,
      String cause,
      String originalText,
      HighlightRulesParser parser) {
    String message = cause + " @ "
        + ctx.getText() + ": " + ctx.toInfoString(parser);
    return new PatternSyntaxException(
        message,
        originalText,
        ctx.start.getStartIndex());
  }

  /**
   * Compile a rule file.
   *
   * @param text The contents of the rule file.
   * @param baseStyles The styles available before the file's own style declarations.
   *
   * @return The compiled rule set.
   *
   * @throws PatternSyntaxException Thrown if the file could not be parsed, refers to
   *         an unknown style, contains a malformed regex, or is otherwise invalid.
   */
  public static RuleSet compile(String text, StyleRegistry baseStyles)
      throws PatternSyntaxException {
    return compile(CharStreams.fromString(text), text, baseStyles);
  }

  /**
   * Compile a rule file, on top of the {@linkplain StyleRegistry#defaults() default styles}.
   *
   * @see #compile(String, StyleRegistry)
   */
  public static RuleSet compile(String text) throws PatternSyntaxException {
    return compile(text, StyleRegistry.defaults());
  }

  /**
   * Read and compile a rule file, on top of the
   * {@linkplain StyleRegistry#defaults() default styles}.
   *
   * @param reader The reader to read the file from. This is not closed.
   *
   * @return The compiled rule set.
   *
   * @throws IOException Thrown if the reader could not be read.
   * @throws PatternSyntaxException Thrown if the rule file is invalid.
   *
   * @see #compile(String, StyleRegistry)
   */
  public static RuleSet load(Reader reader) throws IOException, PatternSyntaxException {
    CharStream input = CharStreams.fromReader(reader);
    return compile(input, input.toString(), StyleRegistry.defaults());
  }

  /**
   * Load the default rules, from the {@link #DEFAULT_RESOURCE} classpath resource.
   *
   * @return The default rule set.
   *
   * @throws IllegalStateException Thrown if the resource is missing.
   * @throws UncheckedIOException Thrown if the resource could not be read.
   */
  public static RuleSet loadDefaults() {
    InputStream stream = RuleCompiler.class.getResourceAsStream("/" + DEFAULT_RESOURCE);
    if (stream == null) {
      throw new IllegalStateException("Could not find resource " + DEFAULT_RESOURCE);
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return load(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read resource " + DEFAULT_RESOURCE, e);
    }
  }

  /** The implementation of {@link #compile(String, StyleRegistry)}. */
  private static RuleSet compile(CharStream input, String originalText,
      StyleRegistry baseStyles) throws PatternSyntaxException {
    // Run the parser
    HighlightRulesLexer lexer = new HighlightRulesLexer(input);
    // Replace Antlr's console listener; the first error is thrown as an exception
    lexer.removeErrorListeners();
    lexer.addErrorListener(new ThrowingErrorListener(originalText));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    HighlightRulesParser parser = new HighlightRulesParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(new ThrowingErrorListener(originalText));
    RulesContext eval = parser.rules();

    // Visit the declarations
    ElementVisitor elementVisitor = new ElementVisitor(originalText, parser);
    StyleVisitor styleVisitor = new StyleVisitor(originalText, parser);
    Map<String, Style> declaredStyles = new LinkedHashMap<>();
    Set<String> ruleNames = new HashSet<>();
    List<Rule> rules = new ArrayList<>();
    for (DeclarationContext declaration : eval.declaration()) {
      if (declaration instanceof Style_declarationContext) {
        Style_declContext styleDecl = ((Style_declarationContext) declaration).style_decl();
        String name = styleDecl.name().getText();
        if (declaredStyles.containsKey(name)) {
          throw mkException(styleDecl, "Duplicate style '" + name + "'", originalText, parser);
        }
        declaredStyles.put(name, styleDecl.accept(styleVisitor));
      } else {
        Rule_declContext ruleDecl = ((Rule_declarationContext) declaration).rule_decl();
        rules.add(compileRule(ruleDecl, elementVisitor, ruleNames, originalText, parser));
      }
    }

    // Resolve the style names
    StyleRegistry styles = baseStyles.merge(new StyleRegistry(declaredStyles));
    for (Name_fieldContext reference : elementVisitor.styleReferences) {
      String name = reference.name(1).getText();
      if (!styles.contains(name)) {
        throw mkException(reference, "Unknown style '" + name + "'", originalText, parser);
      }
    }

    log.info("Compiled {} highlight rules and {} styles ({} declared)",
        rules.size(), styles.names().size(), declaredStyles.size());
    return new RuleSet(rules, styles);
  }

  /** Compile a single <code>rule</code> declaration. */
  private static Rule compileRule(Rule_declContext ctx, ElementVisitor elementVisitor,
      Set<String> ruleNames, String originalText, HighlightRulesParser parser) {
    String name = null;
    if (ctx.name() != null) {
      name = ctx.name().getText();
      if (!ruleNames.add(name)) {
        throw mkException(ctx, "Duplicate rule name '" + name + "'", originalText, parser);
      }
    }
    int priority = Rule.DEFAULT_PRIORITY;
    if (ctx.priority() != null) {
      try {
        priority = Integer.parseInt(ctx.priority().Number().getText());
      } catch (NumberFormatException e) {
        throw mkException(ctx.priority(), "Could not parse priority", originalText, parser);
      }
    }
    if (ctx.element().isEmpty()) {
      throw mkException(ctx, "A rule must have at least one matcher", originalText, parser);
    }
    return new Rule(name, elementVisitor.visitSequence(ctx.element()), priority);
  }
}

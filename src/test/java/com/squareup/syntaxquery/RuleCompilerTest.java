package com.squareup.syntaxquery;

import static com.squareup.syntaxquery.TokenTrees.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

/**
 * Unit test {@link RuleCompiler}.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class RuleCompilerTest {

  /**
   * This function compiles a rule and then writes it out to a string via
   * {@link Rule#toString()}; it then checks that the written string is the
   * expected rule.
   */
  private static DynamicTest losslessToString(String expected, String rule) {
    return DynamicTest.dynamicTest(rule, () -> {
      RuleSet rules = RuleCompiler.compile(rule);
      assertEquals(1, rules.size());
      assertEquals(expected, rules.rules.get(0).toString(), "Rule's toString is lossy");
    });
  }

  /**
   * @see #losslessToString(String, String)
   */
  private static DynamicTest losslessToString(String rule) {
    return losslessToString(rule, rule);
  }

  /**
   * Ensure that a rule file is rejected, with an error message containing the given text.
   */
  private static DynamicTest invalid(String text, String messageFragment) {
    return DynamicTest.dynamicTest("should reject: " + text, () -> {
      PatternSyntaxException e = assertThrows(PatternSyntaxException.class,
          () -> RuleCompiler.compile(text));
      assertTrue(e.getMessage().contains(messageFragment),
          "Expected '" + messageFragment + "' in: " + e.getMessage());
    });
  }

  /**
   * Tests that {@link Rule#toString()} writes what was compiled.
   */
  @TestFactory Iterable<DynamicTest> losslessToString() {
    return Arrays.asList(
        losslessToString("rule [];"),
        losslessToString("rule [kind:/STRING/ hl:command];"),
        losslessToString("rule [!kind:/Dnull|Snull/ hl:string]*;"),
        losslessToString("rule [regex:/^-/ !regex:/=/]+?;"),
        losslessToString("rule [hl:flag hlregex:/^-[^=]*/]?;"),
        losslessToString("rule [kind:/a/]??;"),
        losslessToString("rule [kind:/a/]*?;"),
        losslessToString("rule [kind:/a/]+;"),
        losslessToString("rule ^ [kind:/a/] $;"),
        losslessToString("rule named: @10 [kind:/a/];"),
        losslessToString("rule @-3 [kind:/a/];"),
        losslessToString("rule [contains:(^ [kind:/FUNC/ hl:func] []*)];"),
        losslessToString("rule [kind:/STRING/ contains:([kind:/x/ contains:([])])];"),
        // Whitespace and field order are normalized
        losslessToString("rule [kind:/STRING/ hl:string];", "rule  [ hl : string\n kind:/STRING/ ] ;"),
        losslessToString("rule [kind:/a/]*?;", "rule [kind:/a/]* ?;"),
        // Keywords can be names
        losslessToString("rule rule: [hl:style];", "style style { bold: true; }\nrule rule: [hl:style];")
    );
  }

  /**
   * Tests that invalid rule files are rejected with a useful message.
   */
  @TestFactory Iterable<DynamicTest> invalidRules() {
    return Arrays.asList(
        invalid("rule [kind:/a/]", "Syntax error"),
        invalid("rule [kind /a/];", "Syntax error"),
        invalid("rule [kind:/a/]**;", "Syntax error"),
        invalid("rule ^*;", "Syntax error"),
        invalid("rule [kind:/a/ %];", "Syntax error"),
        invalid("rules [];", "Syntax error"),
        invalid("rule ;", "at least one matcher"),
        invalid("rule [contains:()];", "non-empty nested sequence"),
        invalid("rule [hlregex:/x/];", "requires a style"),
        invalid("rule [hl:no_such_style];", "Unknown style 'no_such_style'"),
        invalid("rule [colour:/x/];", "Unknown key 'colour'"),
        invalid("rule [kind:STRING];", "does not take a name"),
        invalid("rule [kind:([])];", "Only 'contains'"),
        invalid("rule [!hlregex:/x/ hl:flag];", "cannot be negated"),
        invalid("rule [kind:/a/ kind:/b/];", "Duplicate key 'kind'"),
        invalid("rule a: [];\nrule a: [];", "Duplicate rule name 'a'"),
        invalid("rule @99999999999 [];", "Could not parse priority"),
        invalid("style s { fg: red; }\nstyle s { fg: blue; }", "Duplicate style 's'"),
        invalid("style s { fg: red; fg: blue; }", "Duplicate style attribute 'fg'"),
        invalid("style s { fg: chartreuse; }", "Unknown colour"),
        invalid("style s { glow: true; }", "Unknown style attribute"),
        invalid("style s { bold: maybe; }", "must be true or false")
    );
  }

  /**
   * A malformed regex fails with the error from compiling it.
   */
  @Test void malformedRegex() {
    PatternSyntaxException e = assertThrows(PatternSyntaxException.class,
        () -> RuleCompiler.compile("rule [kind:/(unclosed/];"));
    assertEquals("(unclosed", e.getPattern());
  }

  /**
   * Errors point at where in the file they happened.
   */
  @Test void errorIndex() {
    String text = "rule [];\nrule [hl:nope];";
    PatternSyntaxException e = assertThrows(PatternSyntaxException.class,
        () -> RuleCompiler.compile(text));
    assertEquals(text, e.getPattern());
    assertEquals(text.indexOf("hl:nope"), e.getIndex());
  }

  /**
   * Styles declared in the file are merged over the base registry, and can be
   * used before they are declared.
   */
  @Test void styleDeclarations() {
    RuleSet rules = RuleCompiler.compile(
        "rule [kind:/x/ hl:shiny];\n"
        + "# A comment, which is not a colour\n"
        + "style shiny { fg: #00ff00; bold: true; }   # a trailing comment\n"
        + "style string { fg: reset; }\n");
    Style shiny = rules.styles.get("shiny");
    assertNotNull(shiny);
    assertEquals(Color.rgb(0x00ff00), shiny.fg);
    assertEquals(Boolean.TRUE, shiny.bold);
    assertEquals(Color.RESET, rules.styles.get("string").fg);
    assertNull(rules.styles.get("string").bg);
    assertTrue(rules.styles.contains("command"));
  }

  /**
   * Comments whose text starts with a hex digit are still comments.
   */
  @Test void hexLikeComments() {
    RuleSet rules = RuleCompiler.compile(
        "#Comments about flags\n"
        + "rule [kind:/x/];\n"
        + "#define a style\n"
        + "style shiny { fg: #00ff00; }  #ab trailing\n");
    assertEquals(1, rules.size());
    assertEquals(Color.rgb(0x00ff00), rules.styles.get("shiny").fg);
  }

  /**
   * A custom base registry replaces the default styles.
   */
  @Test void customBaseStyles() {
    StyleRegistry base = StyleRegistry.empty().with("only", Style.reset());
    assertEquals(1, RuleCompiler.compile("rule [hl:only];", base).size());
    assertThrows(PatternSyntaxException.class,
        () -> RuleCompiler.compile("rule [hl:string];", base));
  }

  /**
   * An empty file, or one with only comments, has no rules.
   */
  @Test void emptyFile() {
    assertEquals(0, RuleCompiler.compile("").size());
    assertEquals(0, RuleCompiler.compile("# nothing here\n#\n").size());
  }

  /**
   * Rules can be read from a reader.
   */
  @Test void load() throws IOException {
    RuleSet rules = RuleCompiler.load(new StringReader(
        "rule a: [kind:/STRING/ hl:string];\nrule b: [kind:/comment/ hl:comment];\n"));
    assertEquals(
        Arrays.asList("a", "b"),
        rules.rules.stream().map(rule -> rule.name).collect(Collectors.toList()));
  }

  /**
   * The default rules compile, and highlight a simple command.
   */
  @Test void defaults() {
    RuleSet rules = RuleCompiler.loadDefaults();
    assertTrue(rules.size() > 10);
    String buffer = "ls -l";
    List<HighlightSpan> spans = HighlightResolver.resolve(
        rules, List.of(leaf(0, 2, "STRING"), leaf(3, 5, "STRING")), buffer);
    List<String> styles = spans.stream()
        .map(span -> span.styleName + "[" + span.start + "," + span.finish + ")")
        .collect(Collectors.toList());
    assertEquals(Arrays.asList("flag[3,5)", "command[0,2)"), styles);
  }

  /** Render spans as <code>style[start,finish)</code> strings, in paint order. */
  private static List<String> render(List<HighlightSpan> spans) {
    return spans.stream()
        .map(span -> span.styleName + "[" + span.start + "," + span.finish + ")")
        .collect(Collectors.toList());
  }

  /**
   * The default rules reset a substitution inside a string to normal, and the
   * command inside the substitution paints over the reset.
   */
  @Test void defaultsSubstitution() {
    List<String> spans = render(HighlightResolver.resolve(
        RuleCompiler.loadDefaults(), substitutionTree(), SUBSTITUTION_BUFFER));
    assertEquals(List.of("normal[7,12)", "command[0,4)", "command[9,11)"), spans);
    assertTrue(spans.indexOf("command[9,11)") > spans.lastIndexOf("normal[7,12)"));
  }

  /**
   * With two substitutions in a string, both are reset, and each command inside
   * them is still a command.
   */
  @Test void defaultsTwoSubstitutions() {
    String buffer = "echo \"$(a)$(b)\"";
    List<Token> tokens = List.of(
        leaf(0, 4, "STRING"),
        tok(5, 15, "STRING",
            tok(6, 10, "substitution", leaf(8, 9, "STRING")),
            tok(10, 14, "substitution", leaf(12, 13, "STRING"))));
    assertEquals(
        List.of("normal[6,10)", "normal[10,14)", "command[0,4)", "command[8,9)", "command[12,13)"),
        render(HighlightResolver.resolve(RuleCompiler.loadDefaults(), tokens, buffer)));
  }
}

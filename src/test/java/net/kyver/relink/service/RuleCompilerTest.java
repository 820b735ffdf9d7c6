package net.kyver.relink.service;

import net.kyver.relink.core.ValidationResult;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.core.replacement.StreamingReplacer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class RuleCompilerTest {

    private RuleCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler();
    }

    @Test
    void testParseRules() {
        List<RuleDefinition> rules = compiler.parse(
                "[{\"pattern\": \"a(b)\", \"replacement\": \"$1\", \"flags\": \"i\"}, {\"pattern\": \"x\"}]");

        assertEquals(2, rules.size());
        assertEquals("a(b)", rules.get(0).getPattern());
        assertEquals("$1", rules.get(0).getReplacement());
        assertEquals("i", rules.get(0).getFlags());
        assertNull(rules.get(1).getReplacement());
    }

    @Test
    void testParseBlankIsEmpty() {
        assertTrue(compiler.parse("").isEmpty());
        assertTrue(compiler.parse(null).isEmpty());
    }

    @Test
    void testParseInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> compiler.parse("[{\"pattern\": "));
        assertThrows(IllegalArgumentException.class, () -> compiler.parse("{\"pattern\": \"x\"}"));
    }

    @Test
    void testValidRules() {
        ValidationResult result = compiler.validate(List.of(
                new RuleDefinition("(\\w+)@(\\w+)", "$2", null),
                new RuleDefinition("foo", "bar", "im")));

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testEmptyPatternIsError() {
        ValidationResult result = compiler.validate(List.of(
                new RuleDefinition("ok", "", null),
                new RuleDefinition("", "x", null)));

        assertFalse(result.isValid());
        assertEquals(List.of("rule[1]: pattern is empty"), result.getErrors());
    }

    @Test
    void testInvalidPatternIsError() {
        ValidationResult result = compiler.validate(List.of(new RuleDefinition("a(b", "x", null)));

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).startsWith("rule[0]: invalid pattern: "));
    }

    @Test
    void testUnknownFlagIsError() {
        ValidationResult result = compiler.validate(List.of(new RuleDefinition("a", "b", "iq")));

        assertEquals(List.of("rule[0]: unknown flag 'q'"), result.getErrors());
    }

    @Test
    void testMissingGroupIsError() {
        ValidationResult result = compiler.validate(List.of(new RuleDefinition("(a)", "$2", null)));

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("group 2"));
    }

    @Test
    void testBrokenReplacementIsError() {
        ValidationResult result = compiler.validate(List.of(new RuleDefinition("a", "cost: $", null)));

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).startsWith("rule[0]: invalid replacement: "));
    }

    @Test
    void testEmptyMatchIsWarning() {
        ValidationResult result = compiler.validate(List.of(new RuleDefinition("x*", "-", null)));

        assertTrue(result.isValid());
        assertEquals(List.of("rule[0]: pattern can match the empty string"), result.getWarnings());
    }

    @Test
    void testNoRulesIsWarning() {
        ValidationResult result = compiler.validate(List.of());

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
    }

    @Test
    void testParseFlags() {
        assertEquals(0, RuleCompiler.parseFlags(null));
        assertEquals(Pattern.CASE_INSENSITIVE | Pattern.DOTALL, RuleCompiler.parseFlags("si"));
        assertThrows(IllegalArgumentException.class, () -> RuleCompiler.parseFlags("g"));
    }

    @Test
    void testCompile() {
        ReplacementRules<Void> rules = compiler.compile(List.of(
                new RuleDefinition("(?<user>\\w+)@example\\.com", "$1 at example", null),
                new RuleDefinition("HELLO", "hi", "i")));

        assertEquals(2, rules.size());
        assertEquals("hi, joe at example", new StreamingReplacer().replaceAll("Hello, joe@example.com", rules, null));
    }

    @Test
    void testCompileRejectsInvalidRules() {
        assertThrows(IllegalArgumentException.class,
                () -> compiler.compile(List.of(new RuleDefinition("(", "x", null))));
    }
}

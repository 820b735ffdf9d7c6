package net.kyver.relink.core.replacement;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementTemplateTest {

    private static Matcher match(String regex, String text) {
        Matcher matcher = Pattern.compile(regex).matcher(text);
        assertTrue(matcher.find());
        return matcher;
    }

    @Test
    void testLiteralTemplate() {
        ReplacementTemplate template = ReplacementTemplate.parse("fixed");

        assertEquals("fixed", template.expand(match("x", "x")));
        assertEquals(0, template.maxGroupReference());
    }

    @Test
    void testNullMeansEmpty() {
        assertEquals("", ReplacementTemplate.parse(null).expand(match("x", "x")));
    }

    @Test
    void testGroupReferences() {
        Matcher matcher = match("(\\w+)@(\\w+)", "john@example");
        ReplacementTemplate template = ReplacementTemplate.parse("$2 <- $1 ($0)");

        assertEquals("example <- john (john@example)", template.expand(matcher));
        assertEquals(2, template.maxGroupReference());
    }

    @Test
    void testMultiDigitReferenceFollowsMatcher() {
        Matcher matcher = match("(a)(b)", "ab");
        ReplacementTemplate template = ReplacementTemplate.parse("$10");

        assertEquals(matcher.replaceFirst("$10"), template.expand(match("(a)(b)", "ab")));
        assertEquals("a0", template.expand(match("(a)(b)", "ab")));
    }

    @Test
    void testEscapes() {
        ReplacementTemplate template = ReplacementTemplate.parse("\\$1 costs \\\\");

        assertEquals("$1 costs \\", template.expand(match("(x)", "x")));
    }

    @Test
    void testUnmatchedGroupIsEmpty() {
        ReplacementTemplate template = ReplacementTemplate.parse("[$1]");

        assertEquals("[]", template.expand(match("(a)?b", "b")));
    }

    @Test
    void testMissingGroupFails() {
        ReplacementTemplate template = ReplacementTemplate.parse("$3");

        assertEquals(3, template.maxGroupReference());
        assertThrows(IndexOutOfBoundsException.class, () -> template.expand(match("(a)", "a")));
    }

    @Test
    void testInvalidTemplates() {
        assertThrows(IllegalArgumentException.class, () -> ReplacementTemplate.parse("trailing\\"));
        assertThrows(IllegalArgumentException.class, () -> ReplacementTemplate.parse("cost: $"));
        assertThrows(IllegalArgumentException.class, () -> ReplacementTemplate.parse("${name}"));
    }
}

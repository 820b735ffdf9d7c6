package net.kyver.relink.core.replacement;

import java.util.regex.MatchResult;

/**
 * Replacement text with {@code $n} group references, following the rules of
 * {@link java.util.regex.Matcher#appendReplacement}: a reference takes as many digits as
 * still name an existing group, and a backslash escapes the next character.
 */
public final class ReplacementTemplate {

    private final String template;
    private final boolean literal;

    private ReplacementTemplate(String template, boolean literal) {
        this.template = template;
        this.literal = literal;
    }

    public static ReplacementTemplate parse(String template) {
        if (template == null) {
            return new ReplacementTemplate("", true);
        }
        boolean literal = true;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '\\') {
                if (++i == template.length()) {
                    throw new IllegalArgumentException("Character to be escaped is missing");
                }
                literal = false;
            } else if (c == '$') {
                if (i + 1 == template.length() || !isDigit(template.charAt(i + 1))) {
                    throw new IllegalArgumentException("Illegal group reference at index " + i + " in: " + template);
                }
                literal = false;
            }
        }
        return new ReplacementTemplate(template, literal);
    }

    /**
     * Highest group the template needs to exist. Only the leading digit of a reference is
     * mandatory, later digits are consumed only when such a group exists.
     */
    public int maxGroupReference() {
        int max = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '$') {
                max = Math.max(max, template.charAt(i + 1) - '0');
            }
        }
        return max;
    }

    public String expand(MatchResult match) {
        if (literal) {
            return template;
        }
        StringBuilder result = new StringBuilder(template.length() + 16);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '\\') {
                result.append(template.charAt(i + 1));
                i += 2;
            } else if (c == '$') {
                int group = template.charAt(++i) - '0';
                i++;
                while (i < template.length() && isDigit(template.charAt(i))) {
                    int next = group * 10 + (template.charAt(i) - '0');
                    if (next > match.groupCount()) {
                        break;
                    }
                    group = next;
                    i++;
                }
                if (group > match.groupCount()) {
                    throw new IndexOutOfBoundsException("No group " + group + " in template: " + template);
                }
                String value = match.group(group);
                if (value != null) {
                    result.append(value);
                }
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    public String getTemplate() {
        return template;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    @Override
    public String toString() {
        return template;
    }
}

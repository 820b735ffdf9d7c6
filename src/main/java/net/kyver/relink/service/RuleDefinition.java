package net.kyver.relink.service;

/**
 * A replacement rule as posted to the API: {@code {"pattern": "...", "replacement": "...", "flags": "i"}}.
 */
public class RuleDefinition {

    private String pattern;
    private String replacement;
    private String flags;

    public RuleDefinition() {
    }

    public RuleDefinition(String pattern, String replacement, String flags) {
        this.pattern = pattern;
        this.replacement = replacement;
        this.flags = flags;
    }

    public String getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public String getFlags() {
        return flags;
    }

    @Override
    public String toString() {
        return String.format("RuleDefinition{pattern='%s', replacement='%s', flags='%s'}",
                pattern, replacement, flags);
    }
}

package net.kyver.relink.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import net.kyver.relink.core.ValidationResult;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.core.replacement.ReplacementTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.reflect.Type;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns JSON rule definitions into {@link ReplacementRules}.
 */
@Component
public class RuleCompiler {
    private static final Logger logger = LoggerFactory.getLogger(RuleCompiler.class);

    private static final Type RULE_LIST_TYPE = new TypeToken<List<RuleDefinition>>(){}.getType();

    private final Gson gson;

    public RuleCompiler() {
        this.gson = new Gson();
    }

    public List<RuleDefinition> parse(String rulesJson) {
        if (rulesJson == null || rulesJson.isBlank()) {
            return List.of();
        }
        try {
            List<RuleDefinition> rules = gson.fromJson(rulesJson, RULE_LIST_TYPE);
            return rules != null ? rules : List.of();
        } catch (JsonParseException e) {
            logger.warn("Failed to parse rules JSON: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid rules JSON: " + e.getMessage(), e);
        }
    }

    public ValidationResult validate(List<RuleDefinition> rules) {
        ValidationResult result = new ValidationResult();

        if (rules.isEmpty()) {
            result.addWarning("No rules given, content passes through unchanged");
        }

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                result.addError(i, "rule is null");
                continue;
            }
            if (rule.getPattern() == null || rule.getPattern().isEmpty()) {
                result.addError(i, "pattern is empty");
                continue;
            }

            int flags;
            try {
                flags = parseFlags(rule.getFlags());
            } catch (IllegalArgumentException e) {
                result.addError(i, e.getMessage());
                continue;
            }

            Pattern pattern;
            try {
                pattern = Pattern.compile(rule.getPattern(), flags);
            } catch (PatternSyntaxException e) {
                result.addError(i, "invalid pattern: " + e.getDescription());
                continue;
            }

            if (pattern.matcher("").find()) {
                result.addWarning(i, "pattern can match the empty string");
            }

            validateReplacement(i, rule.getReplacement(), pattern, result);
        }

        return result;
    }

    /**
     * Compiles rules that passed {@link #validate}. Anything invalid raises
     * {@link IllegalArgumentException} listing every error.
     */
    public <C> ReplacementRules<C> compile(List<RuleDefinition> rules) {
        ValidationResult validation = validate(rules);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid rules: " + validation.getErrors());
        }

        ReplacementRules.Builder<C> builder = ReplacementRules.builder();
        for (RuleDefinition rule : rules) {
            Pattern pattern = Pattern.compile(rule.getPattern(), parseFlags(rule.getFlags()));
            builder.template(pattern, rule.getReplacement());
        }
        return builder.build();
    }

    static int parseFlags(String flags) {
        if (flags == null) {
            return 0;
        }
        int result = 0;
        for (char flag : flags.toCharArray()) {
            result |= switch (flag) {
                case 'i' -> Pattern.CASE_INSENSITIVE;
                case 'm' -> Pattern.MULTILINE;
                case 's' -> Pattern.DOTALL;
                case 'x' -> Pattern.COMMENTS;
                case 'u' -> Pattern.UNICODE_CASE;
                default -> throw new IllegalArgumentException("unknown flag '" + flag + "'");
            };
        }
        return result;
    }

    private static void validateReplacement(int index, String replacement, Pattern pattern, ValidationResult result) {
        ReplacementTemplate template;
        try {
            template = ReplacementTemplate.parse(replacement);
        } catch (IllegalArgumentException e) {
            result.addError(index, "invalid replacement: " + e.getMessage());
            return;
        }

        int groupCount = pattern.matcher("").groupCount();
        if (template.maxGroupReference() > groupCount) {
            result.addError(index, String.format("replacement refers to group %d but the pattern has %d",
                    template.maxGroupReference(), groupCount));
        }
    }
}

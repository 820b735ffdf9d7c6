package net.kyver.relink.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Errors and warnings collected while checking a rule set. Messages about a single rule
 * are prefixed with its position, so {@code rule[2]: empty pattern}.
 */
public class ValidationResult {

    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addError(int ruleIndex, String error) {
        errors.add(ruleLabel(ruleIndex) + error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addWarning(int ruleIndex, String warning) {
        warnings.add(ruleLabel(ruleIndex) + warning);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isValid() {
        return !hasErrors();
    }

    private static String ruleLabel(int ruleIndex) {
        return "rule[" + ruleIndex + "]: ";
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{errors=%s, warnings=%s}", errors, warnings);
    }
}

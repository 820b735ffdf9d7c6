package net.kyver.relink.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered set of {@link FileRule}s. Registration order is the order in which rules are
 * tested and applied to a file, so a later rule sees the output of an earlier one.
 */
public class FileRuleRegistry {
    private final List<FileRule> rules;

    public FileRuleRegistry() {
        this.rules = new ArrayList<>();
    }

    public FileRuleRegistry(List<FileRule> rules) {
        this();
        rules.forEach(this::register);
    }

    public FileRuleRegistry register(FileRule rule) {
        rules.add(Objects.requireNonNull(rule, "Rule cannot be null"));
        return this;
    }

    public List<FileRule> getAllRules() {
        return Collections.unmodifiableList(rules);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}

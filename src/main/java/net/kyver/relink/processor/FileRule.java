package net.kyver.relink.processor;

import net.kyver.relink.core.replacement.ReplacementRules;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A file predicate paired with the replacement rules applied to every file it accepts.
 */
public final class FileRule {

    @FunctionalInterface
    public interface FileMatcher {
        /**
         * May block, for example to sniff the file's content.
         */
        boolean matches(Path file) throws IOException;
    }

    private final String name;
    private final FileMatcher matcher;
    private final ReplacementRules<FileContext> rules;

    public FileRule(String name, FileMatcher matcher, ReplacementRules<FileContext> rules) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.matcher = Objects.requireNonNull(matcher, "Matcher cannot be null");
        this.rules = Objects.requireNonNull(rules, "Rules cannot be null");
    }

    /**
     * Accepts files whose name ends with one of the given extensions, compared without case.
     */
    public static FileRule forExtensions(String name, ReplacementRules<FileContext> rules, String... extensions) {
        if (extensions.length == 0) {
            throw new IllegalArgumentException("At least one extension is required");
        }
        List<String> suffixes = Arrays.stream(extensions)
                .map(ext -> (ext.startsWith(".") ? ext : "." + ext).toLowerCase(Locale.ROOT))
                .toList();
        return new FileRule(name, file -> {
            Path fileName = file.getFileName();
            if (fileName == null) {
                return false;
            }
            String lower = fileName.toString().toLowerCase(Locale.ROOT);
            return suffixes.stream().anyMatch(lower::endsWith);
        }, rules);
    }

    public boolean matches(Path file) throws IOException {
        return matcher.matches(file);
    }

    public String getName() {
        return name;
    }

    public ReplacementRules<FileContext> getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return String.format("FileRule{name='%s', patterns=%d}", name, rules.size());
    }
}

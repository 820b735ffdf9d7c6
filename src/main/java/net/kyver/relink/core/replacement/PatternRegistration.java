package net.kyver.relink.core.replacement;

import java.util.Objects;
import java.util.regex.Pattern;

public final class PatternRegistration<C> {

    private final Pattern pattern;
    private final ReplacementCallback<C> callback;

    public PatternRegistration(Pattern pattern, ReplacementCallback<C> callback) {
        this.pattern = Objects.requireNonNull(pattern, "Pattern cannot be null");
        this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
    }

    public Pattern getPattern() {
        return pattern;
    }

    public ReplacementCallback<C> getCallback() {
        return callback;
    }

    @Override
    public String toString() {
        return "PatternRegistration{" + pattern + "}";
    }
}

package net.kyver.relink.core.replacement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered, immutable list of pattern registrations.
 * <p>
 * Order is part of the contract: when two patterns match at the same offset the one
 * registered first wins.
 */
public final class ReplacementRules<C> implements Iterable<PatternRegistration<C>> {

    private static final ReplacementRules<?> EMPTY = new ReplacementRules<>(List.of());

    private final List<PatternRegistration<C>> registrations;

    private ReplacementRules(List<PatternRegistration<C>> registrations) {
        this.registrations = Collections.unmodifiableList(registrations);
    }

    @SuppressWarnings("unchecked")
    public static <C> ReplacementRules<C> empty() {
        return (ReplacementRules<C>) EMPTY;
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public List<PatternRegistration<C>> getRegistrations() {
        return registrations;
    }

    public PatternRegistration<C> get(int index) {
        return registrations.get(index);
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    @Override
    public Iterator<PatternRegistration<C>> iterator() {
        return registrations.iterator();
    }

    @Override
    public String toString() {
        return "ReplacementRules" + registrations;
    }

    public static final class Builder<C> {
        private final List<PatternRegistration<C>> registrations = new ArrayList<>();

        private Builder() {
        }

        public Builder<C> add(Pattern pattern, ReplacementCallback<C> callback) {
            registrations.add(new PatternRegistration<>(pattern, callback));
            return this;
        }

        public Builder<C> add(String regex, ReplacementCallback<C> callback) {
            return add(Pattern.compile(regex), callback);
        }

        /**
         * Replaces every occurrence of {@code regex} with a fixed text, no group expansion.
         */
        public Builder<C> add(String regex, String replacement) {
            return add(Pattern.compile(regex), (match, context, count) -> replacement);
        }

        public Builder<C> literal(String target, String replacement) {
            return add(Pattern.compile(Pattern.quote(target)), (match, context, count) -> replacement);
        }

        public Builder<C> remove(Pattern pattern) {
            return add(pattern, (match, context, count) -> null);
        }

        public Builder<C> template(Pattern pattern, String template) {
            ReplacementTemplate compiled = ReplacementTemplate.parse(template);
            return add(pattern, (match, context, count) -> compiled.expand(match));
        }

        public Builder<C> addAll(ReplacementRules<C> rules) {
            registrations.addAll(rules.getRegistrations());
            return this;
        }

        public ReplacementRules<C> build() {
            return new ReplacementRules<>(new ArrayList<>(registrations));
        }
    }
}

package net.kyver.relink.core.replacement;

/**
 * Produces the text that replaces one match.
 *
 * @param <C> type of the per-invocation context
 */
@FunctionalInterface
public interface ReplacementCallback<C> {

    /**
     * @param match           the match being replaced
     * @param context         the value passed to the invocation, unchanged
     * @param invocationCount how many times this pattern was replaced before in the same invocation
     * @return replacement text; {@code null} or empty deletes the match
     */
    String replace(ReplaceMatch match, C context, int invocationCount);
}

package net.kyver.relink.core.replacement;

/**
 * Outcome of one selector round.
 */
final class Selection {

    enum Status {
        /** A match that will not change with more input. */
        MATCH,
        /** Nothing matches in the current buffer. */
        NONE,
        /** A candidate exists but more input could still change or preempt it. */
        PENDING
    }

    private static final Selection NONE = new Selection(Status.NONE, null, null);
    private static final Selection PENDING = new Selection(Status.PENDING, null, null);

    private final Status status;
    private final PatternCursor cursor;
    private final ReplaceMatch match;

    private Selection(Status status, PatternCursor cursor, ReplaceMatch match) {
        this.status = status;
        this.cursor = cursor;
        this.match = match;
    }

    static Selection none() {
        return NONE;
    }

    static Selection pending() {
        return PENDING;
    }

    static Selection of(PatternCursor cursor, ReplaceMatch match) {
        return new Selection(Status.MATCH, cursor, match);
    }

    Status status() {
        return status;
    }

    boolean isMatch() {
        return status == Status.MATCH;
    }

    PatternCursor cursor() {
        return cursor;
    }

    ReplaceMatch match() {
        return match;
    }
}

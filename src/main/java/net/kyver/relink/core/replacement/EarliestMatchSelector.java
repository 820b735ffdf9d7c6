package net.kyver.relink.core.replacement;

/**
 * Picks the match with the smallest start offset across all patterns, ties going to the
 * pattern registered first.
 * <p>
 * Searching never moves a cursor's position; the driver advances only the cursor of the
 * pattern it actually applies. What a search does record is the first offset where the
 * pattern could still start a match given more text, so later rounds resume there instead
 * of rescanning everything behind it.
 * <p>
 * While more input may arrive, a candidate is only returned once it is final: its own
 * search must not have touched the end of the buffer, and no other pattern may be able
 * to start a match in front of it (or at the same offset with higher priority) given more
 * text. Otherwise the round answers {@link Selection.Status#PENDING}.
 */
final class EarliestMatchSelector {

    Selection select(PendingBuffer buffer, CursorRegistry cursors, boolean endOfInput) {
        int length = buffer.length();

        PatternCursor best = null;
        int bestStart = -1;
        for (PatternCursor cursor : cursors) {
            boolean found = cursor.search(length);
            cursor.skipDeadOffsets(length, endOfInput);
            if (found && (best == null || cursor.matchStart() < bestStart)) {
                best = cursor;
                bestStart = cursor.matchStart();
            }
        }

        if (best == null) {
            return Selection.none();
        }
        if (!endOfInput && !isFinal(best, bestStart, cursors, length)) {
            return Selection.pending();
        }

        return Selection.of(best, ReplaceMatch.of(
                best.registration().getPattern(),
                best.index(),
                best.matcher(),
                buffer.origin() + bestStart,
                buffer.substring(0, bestStart)));
    }

    private boolean isFinal(PatternCursor best, int bestStart, CursorRegistry cursors, int length) {
        if (!best.isSettled()) {
            return false;
        }
        for (PatternCursor other : cursors) {
            if (other == best || other.isSettled()) {
                continue;
            }
            // a higher priority pattern may still claim bestStart itself
            int limit = other.index() < best.index() ? bestStart : bestStart - 1;
            int open = other.resume();
            if (open <= limit && other.isOpenAt(open, length)) {
                return false;
            }
        }
        return true;
    }
}

package net.kyver.relink.core.replacement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The cursors of every registered pattern for one invocation, in registration order.
 */
final class CursorRegistry implements Iterable<PatternCursor> {

    private final List<PatternCursor> cursors;

    CursorRegistry(ReplacementRules<?> rules, CharSequence text) {
        List<PatternCursor> list = new ArrayList<>(rules.size());
        int index = 0;
        for (PatternRegistration<?> registration : rules) {
            list.add(new PatternCursor(registration, index++, text));
        }
        this.cursors = Collections.unmodifiableList(list);
    }

    int size() {
        return cursors.size();
    }

    PatternCursor get(int index) {
        return cursors.get(index);
    }

    @Override
    public Iterator<PatternCursor> iterator() {
        return cursors.iterator();
    }

    /**
     * Moves every cursor across a splice of {@code [start, end)} into
     * {@code replacementLength} characters. The pattern that fired resumes after its own
     * replacement, one further after an empty match. Cursors up to the end of the replaced
     * span restart at its start so the new text gets scanned; later cursors shift.
     */
    void afterSplice(PatternCursor fired, int start, int end, int replacementLength) {
        for (PatternCursor cursor : cursors) {
            if (cursor == fired) {
                cursor.moveTo(start + replacementLength + (start == end ? 1 : 0));
            } else {
                cursor.spliced(start, end, replacementLength);
            }
        }
    }

    /**
     * Largest prefix no future match can start in: the smallest cursor, clamped to the buffer.
     */
    int watermark(int length) {
        int watermark = length;
        for (PatternCursor cursor : cursors) {
            watermark = Math.min(watermark, cursor.position());
        }
        return Math.max(0, watermark);
    }

    /**
     * Shifts all cursors after the first {@code flushed} characters left the buffer.
     */
    void rebase(int flushed) {
        for (PatternCursor cursor : cursors) {
            cursor.rebase(flushed);
        }
    }

    List<Integer> invocationCounts() {
        List<Integer> counts = new ArrayList<>(cursors.size());
        for (PatternCursor cursor : cursors) {
            counts.add(cursor.invocationCount());
        }
        return counts;
    }

    void resetAll() {
        for (PatternCursor cursor : cursors) {
            cursor.reset();
        }
    }
}

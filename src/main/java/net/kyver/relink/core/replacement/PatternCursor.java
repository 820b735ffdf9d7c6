package net.kyver.relink.core.replacement;

import java.util.regex.Matcher;

/**
 * Scan state of one pattern for the duration of a single invocation: the offset its next
 * search starts from, its replacement counter and a matcher bound to the pending buffer.
 * <p>
 * Besides the position the cursor remembers which offsets are dead: a match attempt there
 * failed without reading up to the end of the buffer, so no appended text can change the
 * outcome. Everything in {@code [position, resume)} is dead, as is the optional zone
 * {@code [skipFrom, skipTo)} further ahead. Searches start at {@code resume} and jump over
 * the zone, so a pattern that keeps failing does not rescan the same text every round.
 */
final class PatternCursor {

    private final PatternRegistration<?> registration;
    private final int index;
    private final Matcher matcher;
    private final boolean looksBehind;

    private int position;
    private int invocationCount;

    private int resume;
    private int skipFrom;
    private int skipTo;

    // outcome of the last search()
    private boolean found;
    private boolean hitEnd;

    PatternCursor(PatternRegistration<?> registration, int index, CharSequence text) {
        this.registration = registration;
        this.index = index;
        this.matcher = registration.getPattern().matcher(text);
        this.matcher.useTransparentBounds(true);
        this.matcher.useAnchoringBounds(false);
        String source = registration.getPattern().pattern();
        this.looksBehind = source.contains("(?<=") || source.contains("(?<!");
    }

    /**
     * Looks for the leftmost match at or after the cursor, skipping offsets known to be dead.
     * The position itself does not move.
     */
    boolean search(int length) {
        found = false;
        hitEnd = false;
        if (resume > length) {
            hitEnd = true;
            return false;
        }
        int from = resume;
        if (skipFrom < skipTo) {
            for (int offset = resume; offset < skipFrom; offset++) {
                matcher.region(offset, length);
                found = matcher.lookingAt();
                hitEnd |= matcher.hitEnd();
                if (found) {
                    return true;
                }
            }
            from = Math.min(skipTo, length);
        }
        found = matcher.find(from);
        hitEnd |= matcher.hitEnd();
        return found;
    }

    /**
     * Moves {@code resume} past the dead offsets the last {@link #search(int)} walked over:
     * up to the first offset where more input could still start a match, or to the match.
     * Once the input has ended every failed attempt is dead. Leaves the matcher on the
     * match, if there was one.
     */
    void skipDeadOffsets(int length, boolean endOfInput) {
        if (resume > length) {
            return;
        }
        if (found && (!hitEnd || endOfInput)) {
            advanceResume(matcher.start());
            return;
        }
        if (endOfInput) {
            advanceResume(length);
            return;
        }
        int matchStart = found ? matcher.start() : -1;
        int limit = found ? matchStart : length + 1;
        int offset = resume;
        while (offset < limit) {
            if (offset >= skipFrom && offset < skipTo) {
                offset = skipTo;
                continue;
            }
            if (isOpenAt(offset, length)) {
                break;
            }
            offset++;
        }
        advanceResume(Math.min(offset, found ? matchStart : length));
        if (found) {
            matcher.region(matchStart, length);
            matcher.lookingAt();
        }
    }

    private void advanceResume(int offset) {
        resume = Math.max(resume, offset);
        if (skipTo <= resume) {
            skipFrom = resume;
            skipTo = resume;
        }
    }

    /**
     * Whether a match attempt anchored at {@code offset} ran into the end of the buffer,
     * meaning more input could still turn it into a match. Clobbers the matcher state of
     * the last search.
     */
    boolean isOpenAt(int offset, int length) {
        matcher.region(offset, length);
        matcher.lookingAt();
        return matcher.hitEnd();
    }

    /**
     * True when the last search result cannot change no matter what text is appended.
     */
    boolean isSettled() {
        return !hitEnd;
    }

    boolean hasMatch() {
        return found;
    }

    int matchStart() {
        return matcher.start();
    }

    Matcher matcher() {
        return matcher;
    }

    PatternRegistration<?> registration() {
        return registration;
    }

    int index() {
        return index;
    }

    int position() {
        return position;
    }

    /**
     * First offset not known to be dead.
     */
    int resume() {
        return resume;
    }

    void moveTo(int position) {
        this.position = position;
        this.resume = position;
        this.skipFrom = position;
        this.skipTo = position;
    }

    /**
     * Follows a splice of {@code [start, end)} into {@code replacementLength} characters by
     * another pattern. A cursor at or before the end of the replaced span restarts at its
     * start, later cursors shift. Dead offsets from one past the old span end on stay dead,
     * that character of margin covers {@code \b} and {@code ^}. Patterns with lookbehind
     * forget everything they knew.
     */
    void spliced(int start, int end, int replacementLength) {
        int delta = replacementLength - (end - start);
        if (position > end) {
            if (looksBehind) {
                moveTo(position + delta);
            } else {
                position += delta;
                resume += delta;
                skipFrom += delta;
                skipTo += delta;
            }
            return;
        }

        int keepFrom = end + 1;
        int deadFrom = keepFrom;
        int deadTo = keepFrom;
        if (resume > keepFrom) {
            deadTo = resume;
        } else if (skipTo > keepFrom) {
            deadFrom = Math.max(skipFrom, keepFrom);
            deadTo = skipTo;
        }
        moveTo(start);
        if (!looksBehind && deadFrom < deadTo) {
            skipFrom = deadFrom + delta;
            skipTo = deadTo + delta;
        }
    }

    /**
     * Shifts every offset after the first {@code flushed} characters left the buffer.
     */
    void rebase(int flushed) {
        position = Math.max(0, position - flushed);
        resume = Math.max(0, resume - flushed);
        skipFrom = Math.max(0, skipFrom - flushed);
        skipTo = Math.max(0, skipTo - flushed);
    }

    int invocationCount() {
        return invocationCount;
    }

    void recordReplacement() {
        invocationCount++;
    }

    void reset() {
        moveTo(0);
        found = false;
        hitEnd = false;
    }

    @Override
    public String toString() {
        return "PatternCursor{" + registration.getPattern() + "@" + position + "}";
    }
}

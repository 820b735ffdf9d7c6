package net.kyver.relink.core.replacement;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Snapshot of one match taken from the pending buffer.
 * <p>
 * Offsets are relative to the pending buffer at the time of the match; use
 * {@link #getOutputOffset()} for the position in the emitted stream. The snapshot stays
 * valid after the buffer moves on.
 */
public final class ReplaceMatch implements MatchResult {

    private final Pattern pattern;
    private final int patternIndex;
    private final int[] spans;
    private final String[] groups;
    private final long outputOffset;
    private final String precedingText;

    ReplaceMatch(Pattern pattern, int patternIndex, int[] spans, String[] groups,
                 long outputOffset, String precedingText) {
        this.pattern = pattern;
        this.patternIndex = patternIndex;
        this.spans = spans;
        this.groups = groups;
        this.outputOffset = outputOffset;
        this.precedingText = precedingText;
    }

    public static ReplaceMatch of(Pattern pattern, int patternIndex, MatchResult result,
                                  long outputOffset, String precedingText) {
        int groupCount = result.groupCount();
        int[] spans = new int[(groupCount + 1) * 2];
        String[] groups = new String[groupCount + 1];
        for (int group = 0; group <= groupCount; group++) {
            spans[group * 2] = result.start(group);
            spans[group * 2 + 1] = result.end(group);
            groups[group] = result.group(group);
        }
        return new ReplaceMatch(pattern, patternIndex, spans, groups, outputOffset, precedingText);
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Registration index of the pattern that produced this match.
     */
    public int getPatternIndex() {
        return patternIndex;
    }

    public long getOutputOffset() {
        return outputOffset;
    }

    /**
     * Pending text in front of the match. Best effort context: it only reaches back to the
     * last flushed position, never further.
     */
    public String getPrecedingText() {
        return precedingText;
    }

    /**
     * Pending text up to and including the match.
     */
    public String getInput() {
        return precedingText + group();
    }

    @Override
    public int start() {
        return start(0);
    }

    @Override
    public int start(int group) {
        checkGroup(group);
        return spans[group * 2];
    }

    @Override
    public int end() {
        return end(0);
    }

    @Override
    public int end(int group) {
        checkGroup(group);
        return spans[group * 2 + 1];
    }

    @Override
    public String group() {
        return group(0);
    }

    @Override
    public String group(int group) {
        checkGroup(group);
        return groups[group];
    }

    @Override
    public int groupCount() {
        return groups.length - 1;
    }

    private void checkGroup(int group) {
        if (group < 0 || group >= groups.length) {
            throw new IndexOutOfBoundsException("No group " + group);
        }
    }

    @Override
    public String toString() {
        return "ReplaceMatch{pattern=" + pattern + ", start=" + start() + ", text='" + group() + "'}";
    }
}

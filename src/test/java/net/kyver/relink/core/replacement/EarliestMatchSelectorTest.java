package net.kyver.relink.core.replacement;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EarliestMatchSelectorTest {

    private final EarliestMatchSelector selector = new EarliestMatchSelector();

    private static PendingBuffer bufferOf(String text) {
        PendingBuffer buffer = new PendingBuffer();
        buffer.append(text);
        return buffer;
    }

    private static ReplacementRules<Void> rules(String... patterns) {
        ReplacementRules.Builder<Void> builder = ReplacementRules.builder();
        for (String pattern : patterns) {
            builder.add(pattern, "");
        }
        return builder.build();
    }

    @Test
    void testSmallestStartWins() {
        PendingBuffer buffer = bufferOf("abc");
        CursorRegistry cursors = new CursorRegistry(rules("c", "a"), buffer.text());

        Selection selection = selector.select(buffer, cursors, true);

        assertTrue(selection.isMatch());
        assertEquals(1, selection.match().getPatternIndex());
        assertEquals(0, selection.match().start());
    }

    @Test
    void testTieGoesToFirstRegistered() {
        PendingBuffer buffer = bufferOf("xab");
        CursorRegistry cursors = new CursorRegistry(rules("a", "ab"), buffer.text());

        Selection selection = selector.select(buffer, cursors, false);

        assertTrue(selection.isMatch());
        assertEquals(0, selection.match().getPatternIndex());
        assertEquals("a", selection.match().group());
    }

    @Test
    void testNoMatch() {
        PendingBuffer buffer = bufferOf("xyz");
        CursorRegistry cursors = new CursorRegistry(rules("a", "b"), buffer.text());

        assertEquals(Selection.Status.NONE, selector.select(buffer, cursors, true).status());
    }

    @Test
    void testMatchTouchingEndIsPending() {
        PendingBuffer buffer = bufferOf("ab12");
        CursorRegistry cursors = new CursorRegistry(rules("\\d+"), buffer.text());

        assertEquals(Selection.Status.PENDING, selector.select(buffer, cursors, false).status());

        Selection last = selector.select(buffer, cursors, true);
        assertTrue(last.isMatch());
        assertEquals("12", last.match().group());
    }

    @Test
    void testPendingWhileEarlierPatternMayStillMatch() {
        PendingBuffer buffer = bufferOf("ab");
        CursorRegistry cursors = new CursorRegistry(rules("abc", "b"), buffer.text());

        assertEquals(Selection.Status.PENDING, selector.select(buffer, cursors, false).status());

        Selection last = selector.select(buffer, cursors, true);
        assertTrue(last.isMatch());
        assertEquals(1, last.match().getPatternIndex());
    }

    @Test
    void testLowerPriorityPatternDoesNotBlockTie() {
        PendingBuffer buffer = bufferOf("ab");
        CursorRegistry cursors = new CursorRegistry(rules("a", "abc"), buffer.text());

        Selection selection = selector.select(buffer, cursors, false);

        assertTrue(selection.isMatch());
        assertEquals(0, selection.match().getPatternIndex());
    }

    @Test
    void testSearchDoesNotMoveCursors() {
        PendingBuffer buffer = bufferOf("aXbXc");
        CursorRegistry cursors = new CursorRegistry(rules("b", "c", "X"), buffer.text());
        cursors.get(2).moveTo(2);

        Selection selection = selector.select(buffer, cursors, true);

        assertEquals(0, selection.match().getPatternIndex());
        assertEquals(0, cursors.get(0).position());
        assertEquals(0, cursors.get(1).position());
        assertEquals(2, cursors.get(2).position());
    }

    @Test
    void testSearchStartsAtCursor() {
        PendingBuffer buffer = bufferOf("a-a");
        CursorRegistry cursors = new CursorRegistry(rules("a"), buffer.text());
        cursors.get(0).moveTo(1);

        Selection selection = selector.select(buffer, cursors, true);

        assertEquals(2, selection.match().start());
        assertEquals("a-", selection.match().getPrecedingText());
    }

    @Test
    void testFailedSearchRemembersFirstOpenOffset() {
        PendingBuffer buffer = bufferOf("a-a-a");
        CursorRegistry cursors = new CursorRegistry(rules("a", "ab"), buffer.text());

        Selection selection = selector.select(buffer, cursors, false);

        assertTrue(selection.isMatch());
        assertEquals(0, cursors.get(1).position());
        assertEquals(4, cursors.get(1).resume());
    }

    @Test
    void testDeadOffsetsAfterSpliceAreSkipped() {
        PendingBuffer buffer = bufferOf("xa-a-ab");
        CursorRegistry cursors = new CursorRegistry(rules("x", "ab"), buffer.text());

        Selection first = selector.select(buffer, cursors, false);
        assertEquals(0, first.match().getPatternIndex());
        assertEquals(5, cursors.get(1).resume());

        buffer.splice(0, 1, "yy");
        cursors.afterSplice(cursors.get(0), 0, 1, 2);
        assertEquals(0, cursors.get(1).position());
        assertEquals(0, cursors.get(1).resume());

        Selection second = selector.select(buffer, cursors, true);
        assertEquals(1, second.match().getPatternIndex());
        assertEquals(6, second.match().start());
        assertEquals(6, cursors.get(1).resume());
    }
}

package net.kyver.relink.core.replacement;

/**
 * Text read but not yet emitted. Position 0 is the first character that has not been
 * handed to the sink; {@link #origin()} is its offset in the output stream.
 */
final class PendingBuffer {

    private final StringBuilder text = new StringBuilder();
    private long origin;

    CharSequence text() {
        return text;
    }

    int length() {
        return text.length();
    }

    boolean isEmpty() {
        return text.length() == 0;
    }

    long origin() {
        return origin;
    }

    void append(String chunk) {
        text.append(chunk);
    }

    String substring(int start, int end) {
        return text.substring(start, end);
    }

    void splice(int start, int end, String replacement) {
        text.replace(start, end, replacement);
    }

    /**
     * Removes and returns the first {@code count} characters.
     */
    String take(int count) {
        String head = text.substring(0, count);
        text.delete(0, count);
        origin += count;
        return head;
    }

    String takeAll() {
        return take(text.length());
    }
}

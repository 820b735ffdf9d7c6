package net.kyver.relink.core.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory accumulator that keeps every emitted unit.
 */
public class StringChunkSink implements ChunkSink {

    private final List<String> chunks = new ArrayList<>();
    private boolean closed;

    @Override
    public void accept(String chunk) {
        if (closed) {
            throw new IllegalStateException("Sink already closed");
        }
        chunks.add(chunk);
    }

    public List<String> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return String.join("", chunks);
    }
}

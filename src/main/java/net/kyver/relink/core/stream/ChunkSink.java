package net.kyver.relink.core.stream;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Receives emitted output chunks in order.
 */
public interface ChunkSink extends Closeable {

    void accept(String chunk) throws IOException;

    default Path getPath() {
        return null;
    }

    @Override
    default void close() throws IOException {
    }
}

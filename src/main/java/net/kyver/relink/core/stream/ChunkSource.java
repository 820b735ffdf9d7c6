package net.kyver.relink.core.stream;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Pull-based, order-preserving sequence of decoded text chunks.
 * Chunk boundaries carry no meaning for the replacement result.
 */
public interface ChunkSource extends Closeable {

    /**
     * @return the next chunk, or {@code null} once the source is exhausted
     */
    String next() throws IOException;

    /**
     * File backing this source, used in error reports. {@code null} for in-memory sources.
     */
    default Path getPath() {
        return null;
    }

    @Override
    default void close() throws IOException {
    }
}

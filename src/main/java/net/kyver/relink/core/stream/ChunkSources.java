package net.kyver.relink.core.stream;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

public final class ChunkSources {

    private ChunkSources() {
    }

    public static ChunkSource of(String... chunks) {
        return fromIterable(Arrays.asList(chunks));
    }

    public static ChunkSource fromIterable(Iterable<String> chunks) {
        Iterator<String> iterator = chunks.iterator();
        return () -> {
            while (iterator.hasNext()) {
                String chunk = Objects.requireNonNull(iterator.next(), "Chunks cannot be null");
                if (!chunk.isEmpty()) {
                    return chunk;
                }
            }
            return null;
        };
    }

    /**
     * Splits {@code text} into consecutive chunks of at most {@code chunkSize} characters.
     */
    public static ChunkSource split(String text, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        int count = (text.length() + chunkSize - 1) / chunkSize;
        String[] chunks = new String[count];
        for (int i = 0; i < count; i++) {
            chunks[i] = text.substring(i * chunkSize, Math.min(text.length(), (i + 1) * chunkSize));
        }
        return fromIterable(List.of(chunks));
    }
}

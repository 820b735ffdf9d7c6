package net.kyver.relink.core.stream;

import net.kyver.relink.core.CancellationSignal;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public class ReaderChunkSource implements ChunkSource {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final Reader reader;
    private final Path path;
    private final CancellationSignal signal;
    private final char[] buffer;

    private boolean exhausted;
    // a trailing high surrogate held back until its low half arrives
    private char carry;
    private boolean hasCarry;

    public ReaderChunkSource(Reader reader, int chunkSize, CancellationSignal signal) {
        this(reader, chunkSize, signal, null);
    }

    public ReaderChunkSource(Reader reader, int chunkSize, CancellationSignal signal, Path path) {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("Chunk size must be at least 2, got " + chunkSize);
        }
        this.reader = Objects.requireNonNull(reader, "Reader cannot be null");
        this.signal = Objects.requireNonNull(signal, "Signal cannot be null");
        this.buffer = new char[chunkSize];
        this.path = path;
    }

    /**
     * Opens {@code path} for reading. Bytes that are not valid in {@code charset} decode to
     * the replacement character instead of failing the read.
     */
    public static ReaderChunkSource open(Path path, Charset charset, int chunkSize,
                                         CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
        return new ReaderChunkSource(reader, chunkSize, signal, path);
    }

    @Override
    public String next() throws IOException {
        signal.throwIfCancelled();
        if (exhausted) {
            return null;
        }

        int offset = 0;
        if (hasCarry) {
            buffer[offset++] = carry;
            hasCarry = false;
        }

        int read = reader.read(buffer, offset, buffer.length - offset);
        if (read == -1) {
            exhausted = true;
            return offset > 0 ? new String(buffer, 0, offset) : null;
        }

        int length = offset + read;
        if (Character.isHighSurrogate(buffer[length - 1])) {
            carry = buffer[length - 1];
            hasCarry = true;
            length--;
        }
        return new String(buffer, 0, length);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}

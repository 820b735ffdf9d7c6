package net.kyver.relink.core.stream;

import net.kyver.relink.core.CancellationSignal;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.util.Objects;

public class WriterChunkSink implements ChunkSink {

    private final Writer writer;
    private final CancellationSignal signal;
    private final Path path;

    public WriterChunkSink(Writer writer, CancellationSignal signal) {
        this(writer, signal, null);
    }

    public WriterChunkSink(Writer writer, CancellationSignal signal, Path path) {
        this.writer = Objects.requireNonNull(writer, "Writer cannot be null");
        this.signal = Objects.requireNonNull(signal, "Signal cannot be null");
        this.path = path;
    }

    public static WriterChunkSink open(Path path, Charset charset, CancellationSignal signal,
                                       OpenOption... options) throws IOException {
        return new WriterChunkSink(Files.newBufferedWriter(path, charset, options), signal, path);
    }

    @Override
    public void accept(String chunk) throws IOException {
        signal.throwIfCancelled();
        writer.write(chunk);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}

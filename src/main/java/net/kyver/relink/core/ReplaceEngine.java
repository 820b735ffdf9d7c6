package net.kyver.relink.core;

import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.core.replacement.StreamingReplacer;
import net.kyver.relink.core.stream.ChunkSink;
import net.kyver.relink.core.stream.ChunkSource;
import net.kyver.relink.core.stream.ReaderChunkSource;
import net.kyver.relink.core.stream.WriterChunkSink;
import net.kyver.relink.util.PerformanceProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class ReplaceEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReplaceEngine.class);

    private final StreamingReplacer replacer;
    private final PerformanceProfiler profiler;
    private final int chunkSize;

    public ReplaceEngine() {
        this(ReaderChunkSource.DEFAULT_CHUNK_SIZE, new PerformanceProfiler());
    }

    public ReplaceEngine(int chunkSize, @NonNull PerformanceProfiler profiler) {
        this.replacer = new StreamingReplacer();
        this.profiler = Objects.requireNonNull(profiler, "Profiler cannot be null");
        this.chunkSize = chunkSize;

        logger.debug("ReplaceEngine initialized with chunk size: {} chars", chunkSize);
    }

    public <C> ProcessingResult process(@NonNull ChunkSource source,
                                        @NonNull ChunkSink sink,
                                        @NonNull ReplacementRules<C> rules,
                                        C context,
                                        @NonNull CancellationSignal signal) {
        ProcessingResult result = replacer.replace(source, sink, rules, context, signal);
        profiler.recordProcessing(result.getProcessingTimeNanos(), result.getCharsRead(), result.getReplacementCount());
        return result;
    }

    /**
     * Streams {@code input} through the rules into {@code output}. Neither stream is closed;
     * {@code output} is flushed.
     */
    public <C> ProcessingResult processStream(@NonNull InputStream input,
                                              @NonNull OutputStream output,
                                              @NonNull ReplacementRules<C> rules,
                                              C context,
                                              @NonNull Charset charset,
                                              @NonNull CancellationSignal signal) {
        Objects.requireNonNull(input, "Input stream cannot be null");
        Objects.requireNonNull(output, "Output stream cannot be null");
        Objects.requireNonNull(charset, "Charset cannot be null");

        ChunkSource source = new ReaderChunkSource(new InputStreamReader(input, charset), chunkSize, signal);
        Writer writer = new OutputStreamWriter(output, charset);

        ProcessingResult result = process(source, new WriterChunkSink(writer, signal), rules, context, signal);
        try {
            writer.flush();
        } catch (IOException e) {
            throw ReplaceException.sinkWrite(null, e);
        }

        logger.debug("Stream processed in {} ms, {} chars read, {} replacements made",
                String.format("%.2f", result.getProcessingTimeMillis()), result.getCharsRead(),
                result.getReplacementCount());
        return result;
    }

    public <C> ProcessingResult processStream(@NonNull InputStream input,
                                              @NonNull OutputStream output,
                                              @NonNull ReplacementRules<C> rules,
                                              C context) {
        return processStream(input, output, rules, context, StandardCharsets.UTF_8, CancellationSignal.none());
    }

    public <C> String processString(@NonNull String text, @NonNull ReplacementRules<C> rules, C context) {
        return replacer.replaceAll(text, rules, context);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public PerformanceProfiler getProfiler() {
        return profiler;
    }
}

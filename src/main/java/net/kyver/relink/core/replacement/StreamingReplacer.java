package net.kyver.relink.core.replacement;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ProcessingResult;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.stream.ChunkSink;
import net.kyver.relink.core.stream.ChunkSource;
import net.kyver.relink.core.stream.ChunkSources;
import net.kyver.relink.core.stream.StringChunkSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Streaming multi-pattern search and replace.
 * <p>
 * Chunks are appended to a pending buffer. Each round the earliest match across all
 * patterns is replaced in place, so a replacement is visible to every other pattern in the
 * following rounds. Text is released to the sink only up to the watermark, the smallest
 * cursor of all patterns, since nothing in front of it can be matched again. The result is
 * the same for every way of cutting the input into chunks.
 * <p>
 * Memory use is bounded by the span between the watermark and the end of the buffer. A
 * pattern that stops matching pins the watermark, so everything after its last match stays
 * buffered until the end of input.
 * <p>
 * Errors are not recovered: read and write failures surface as {@link ReplaceException},
 * callback exceptions propagate unchanged, and output already handed to the sink stays
 * there. The caller owns and closes the source and the sink.
 */
public class StreamingReplacer {
    private static final Logger logger = LoggerFactory.getLogger(StreamingReplacer.class);

    private final EarliestMatchSelector selector = new EarliestMatchSelector();

    public <C> ProcessingResult replace(ChunkSource source,
                                        ChunkSink sink,
                                        ReplacementRules<C> rules,
                                        C context,
                                        CancellationSignal signal) {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(sink, "Sink cannot be null");
        Objects.requireNonNull(rules, "Rules cannot be null");
        Objects.requireNonNull(signal, "Signal cannot be null");

        if (rules.isEmpty()) {
            return passThrough(source, sink, signal);
        }

        PendingBuffer buffer = new PendingBuffer();
        return replace(source, sink, rules, context, signal, buffer, new CursorRegistry(rules, buffer.text()));
    }

    <C> ProcessingResult replace(ChunkSource source,
                                 ChunkSink sink,
                                 ReplacementRules<C> rules,
                                 C context,
                                 CancellationSignal signal,
                                 PendingBuffer buffer,
                                 CursorRegistry cursors) {
        long startTime = System.nanoTime();
        Emitter emitter = new Emitter(sink);
        long charsRead = 0;

        cursors.resetAll();
        try {
            String chunk;
            while ((chunk = pull(source, signal)) != null) {
                charsRead += chunk.length();
                buffer.append(chunk);
                drain(buffer, cursors, context, emitter, signal, false);
            }
            drain(buffer, cursors, context, emitter, signal, true);

            if (!buffer.isEmpty()) {
                emitter.emit(buffer.takeAll());
            }
        } finally {
            cursors.resetAll();
        }

        ProcessingResult result = new ProcessingResult(charsRead, emitter.charsWritten,
                emitter.chunks, cursors.invocationCounts());
        result.setProcessingTimeNanos(System.nanoTime() - startTime);
        logger.debug("Replacement finished for {} patterns: {}", rules.size(), result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private <C> void drain(PendingBuffer buffer,
                           CursorRegistry cursors,
                           C context,
                           Emitter emitter,
                           CancellationSignal signal,
                           boolean endOfInput) {
        while (true) {
            signal.throwIfCancelled();

            Selection selection = selector.select(buffer, cursors, endOfInput);
            if (!selection.isMatch()) {
                return;
            }

            PatternCursor fired = selection.cursor();
            ReplaceMatch match = selection.match();
            ReplacementCallback<C> callback = (ReplacementCallback<C>) fired.registration().getCallback();

            String replacement = callback.replace(match, context, fired.invocationCount());
            fired.recordReplacement();
            if (replacement == null) {
                replacement = "";
            }

            buffer.splice(match.start(), match.end(), replacement);
            cursors.afterSplice(fired, match.start(), match.end(), replacement.length());

            int watermark = cursors.watermark(buffer.length());
            if (watermark > 0) {
                emitter.emit(buffer.take(watermark));
                cursors.rebase(watermark);
            }
        }
    }

    private ProcessingResult passThrough(ChunkSource source, ChunkSink sink, CancellationSignal signal) {
        long startTime = System.nanoTime();
        Emitter emitter = new Emitter(sink);
        long charsRead = 0;

        String chunk;
        while ((chunk = pull(source, signal)) != null) {
            charsRead += chunk.length();
            emitter.emit(chunk);
        }

        ProcessingResult result = new ProcessingResult(charsRead, emitter.charsWritten, emitter.chunks, List.of());
        result.setProcessingTimeNanos(System.nanoTime() - startTime);
        logger.debug("No patterns registered, passed {} chunks through", emitter.chunks);
        return result;
    }

    private static String pull(ChunkSource source, CancellationSignal signal) {
        signal.throwIfCancelled();
        try {
            return source.next();
        } catch (IOException e) {
            throw ReplaceException.sourceRead(source.getPath(), e);
        }
    }

    /**
     * Replaces {@code text} completely in memory.
     */
    public <C> String replaceAll(String text, ReplacementRules<C> rules, C context) {
        StringChunkSink sink = new StringChunkSink();
        replace(ChunkSources.of(text), sink, rules, context, CancellationSignal.none());
        return sink.toString();
    }

    private static final class Emitter {
        private final ChunkSink sink;
        private long charsWritten;
        private long chunks;

        Emitter(ChunkSink sink) {
            this.sink = sink;
        }

        void emit(String text) {
            if (text.isEmpty()) {
                return;
            }
            try {
                sink.accept(text);
            } catch (IOException e) {
                throw ReplaceException.sinkWrite(sink.getPath(), e);
            }
            charsWritten += text.length();
            chunks++;
        }
    }
}

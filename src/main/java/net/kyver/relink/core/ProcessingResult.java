package net.kyver.relink.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ProcessingResult {

    private final long charsRead;
    private final long charsWritten;
    private final long chunksEmitted;
    private final List<Integer> replacementsPerPattern;
    private long processingTimeNanos;
    private final List<String> warnings;

    public ProcessingResult(long charsRead, long charsWritten, long chunksEmitted,
                            List<Integer> replacementsPerPattern) {
        this.charsRead = charsRead;
        this.charsWritten = charsWritten;
        this.chunksEmitted = chunksEmitted;
        this.replacementsPerPattern = List.copyOf(replacementsPerPattern);
        this.warnings = new ArrayList<>();
    }

    public long getCharsRead() {
        return charsRead;
    }

    public long getCharsWritten() {
        return charsWritten;
    }

    public long getChunksEmitted() {
        return chunksEmitted;
    }

    public long getReplacementCount() {
        long total = 0;
        for (int count : replacementsPerPattern) {
            total += count;
        }
        return total;
    }

    /**
     * Replacement counts in pattern registration order.
     */
    public List<Integer> getReplacementsPerPattern() {
        return replacementsPerPattern;
    }

    public int getPatternCount() {
        return replacementsPerPattern.size();
    }

    public long getProcessingTimeNanos() {
        return processingTimeNanos;
    }

    public void setProcessingTimeNanos(long processingTimeNanos) {
        this.processingTimeNanos = processingTimeNanos;
    }

    public double getProcessingTimeMillis() {
        return processingTimeNanos / 1_000_000.0;
    }

    public double getThroughputMBps() {
        if (processingTimeNanos == 0) return 0.0;
        double seconds = processingTimeNanos / 1_000_000_000.0;
        double megachars = charsRead / (1024.0 * 1024.0);
        return megachars / seconds;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ProcessingResult{read=%d, written=%d, chunks=%d, replacements=%d, patterns=%d, time=%.2fms, throughput=%.2fM chars/s}",
                charsRead, charsWritten, chunksEmitted, getReplacementCount(), getPatternCount(),
                getProcessingTimeMillis(), getThroughputMBps());
    }
}

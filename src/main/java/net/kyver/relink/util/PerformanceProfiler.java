package net.kyver.relink.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public class PerformanceProfiler {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceProfiler.class);

    private final LongAdder totalOperations = new LongAdder();
    private final LongAdder totalProcessingTime = new LongAdder();
    private final LongAdder totalCharsProcessed = new LongAdder();
    private final LongAdder totalReplacements = new LongAdder();

    private final AtomicLong minProcessingTime = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxProcessingTime = new AtomicLong(0);
    private final AtomicLong maxThroughput = new AtomicLong(0);

    private final ConcurrentHashMap<String, LongAdder> operationCounts = new ConcurrentHashMap<>();

    public void recordProcessing(long processingTimeNanos, long charsProcessed, long replacements) {
        totalOperations.increment();
        totalProcessingTime.add(processingTimeNanos);
        totalCharsProcessed.add(charsProcessed);
        totalReplacements.add(replacements);

        minProcessingTime.updateAndGet(current -> Math.min(current, processingTimeNanos));
        maxProcessingTime.updateAndGet(current -> Math.max(current, processingTimeNanos));

        if (processingTimeNanos > 0) {
            long throughput = (charsProcessed * 1_000_000_000L) / processingTimeNanos;
            maxThroughput.updateAndGet(current -> Math.max(current, throughput));
        }
    }

    /**
     * Counts requests by kind, such as {@code transform} or {@code relink}.
     */
    public void recordOperation(String operationType) {
        operationCounts.computeIfAbsent(operationType, k -> new LongAdder()).increment();
    }

    public long getAverageProcessingTimeNanos() {
        long ops = totalOperations.sum();
        return ops > 0 ? totalProcessingTime.sum() / ops : 0;
    }

    public long getAverageThroughputCharsPerSecond() {
        long totalTime = totalProcessingTime.sum();
        return totalTime > 0 ? (totalCharsProcessed.sum() * 1_000_000_000L) / totalTime : 0;
    }

    public long getTotalOperations() {
        return totalOperations.sum();
    }

    public long getTotalCharsProcessed() {
        return totalCharsProcessed.sum();
    }

    public long getTotalReplacements() {
        return totalReplacements.sum();
    }

    public long getMinProcessingTimeNanos() {
        long min = minProcessingTime.get();
        return min == Long.MAX_VALUE ? 0 : min;
    }

    public long getMaxProcessingTimeNanos() {
        return maxProcessingTime.get();
    }

    public long getMaxThroughputCharsPerSecond() {
        return maxThroughput.get();
    }

    public long getOperationCount(String operationType) {
        LongAdder counter = operationCounts.get(operationType);
        return counter != null ? counter.sum() : 0;
    }

    public void reset() {
        totalOperations.reset();
        totalProcessingTime.reset();
        totalCharsProcessed.reset();
        totalReplacements.reset();

        minProcessingTime.set(Long.MAX_VALUE);
        maxProcessingTime.set(0);
        maxThroughput.set(0);

        operationCounts.clear();

        logger.debug("Performance profiler metrics reset");
    }

    public String generateReport() {
        long ops = getTotalOperations();
        if (ops == 0) {
            return "No operations recorded";
        }

        StringBuilder report = new StringBuilder();
        report.append("Performance Report:\n");
        report.append(String.format("  Total Operations: %,d\n", ops));
        report.append(String.format("  Total Chars: %,d (%.2f M)\n",
                     getTotalCharsProcessed(), getTotalCharsProcessed() / (1024.0 * 1024.0)));
        report.append(String.format("  Total Replacements: %,d\n", getTotalReplacements()));
        report.append(String.format("  Average Time: %.2f ms\n", getAverageProcessingTimeNanos() / 1_000_000.0));
        report.append(String.format("  Min Time: %.2f ms\n", getMinProcessingTimeNanos() / 1_000_000.0));
        report.append(String.format("  Max Time: %.2f ms\n", getMaxProcessingTimeNanos() / 1_000_000.0));
        report.append(String.format("  Average Throughput: %.2f M chars/s\n",
                     getAverageThroughputCharsPerSecond() / (1024.0 * 1024.0)));
        report.append(String.format("  Max Throughput: %.2f M chars/s\n",
                     getMaxThroughputCharsPerSecond() / (1024.0 * 1024.0)));
        operationCounts.forEach((type, count) ->
                report.append(String.format("  %s: %,d\n", type, count.sum())));

        return report.toString();
    }
}

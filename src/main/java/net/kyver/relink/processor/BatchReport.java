package net.kyver.relink.processor;

import net.kyver.relink.core.ProcessingResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a directory run. One {@link FileReport} is kept per (file, rule) transform.
 */
public class BatchReport {

    public static final class FileReport {
        private final Path file;
        private final String ruleName;
        private final ProcessingResult result;

        FileReport(Path file, String ruleName, ProcessingResult result) {
            this.file = file;
            this.ruleName = ruleName;
            this.result = result;
        }

        public Path getFile() {
            return file;
        }

        public String getRuleName() {
            return ruleName;
        }

        public ProcessingResult getResult() {
            return result;
        }

        @Override
        public String toString() {
            return String.format("FileReport{file=%s, rule='%s', replacements=%d}",
                    file, ruleName, result.getReplacementCount());
        }
    }

    private final Path root;
    private final List<FileReport> fileReports;
    private long filesVisited;
    private long entriesSkipped;
    private long processingTimeNanos;

    public BatchReport(Path root) {
        this.root = root;
        this.fileReports = new ArrayList<>();
    }

    void fileVisited() {
        filesVisited++;
    }

    void entrySkipped() {
        entriesSkipped++;
    }

    void addFileReport(Path file, String ruleName, ProcessingResult result) {
        fileReports.add(new FileReport(file, ruleName, result));
    }

    void setProcessingTimeNanos(long processingTimeNanos) {
        this.processingTimeNanos = processingTimeNanos;
    }

    public Path getRoot() {
        return root;
    }

    public long getFilesVisited() {
        return filesVisited;
    }

    /**
     * Entries the walk passed over: dangling links, links to directories and special files.
     */
    public long getEntriesSkipped() {
        return entriesSkipped;
    }

    public long getFilesTransformed() {
        return fileReports.stream().map(FileReport::getFile).distinct().count();
    }

    public long getTotalReplacements() {
        return fileReports.stream().mapToLong(report -> report.getResult().getReplacementCount()).sum();
    }

    public List<FileReport> getFileReports() {
        return Collections.unmodifiableList(fileReports);
    }

    public long getProcessingTimeNanos() {
        return processingTimeNanos;
    }

    public double getProcessingTimeMillis() {
        return processingTimeNanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("BatchReport{root=%s, visited=%d, skipped=%d, transformed=%d, replacements=%d, time=%.2fms}",
                root, filesVisited, entriesSkipped, getFilesTransformed(), getTotalReplacements(),
                getProcessingTimeMillis());
    }
}

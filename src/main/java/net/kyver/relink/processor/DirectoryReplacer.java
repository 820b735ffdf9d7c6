package net.kyver.relink.processor;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ProcessingResult;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.ReplaceException.ErrorKind;
import net.kyver.relink.service.file.AtomicFileReplacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Applies a {@link FileRuleRegistry} to every file below a root directory.
 * <p>
 * The tree is walked depth-first with entries visited in name order. Symbolic links are
 * never followed into directories: a link to a regular file is offered to the rules like
 * any other file, and a transform replaces the link with a regular file holding the
 * rewritten content. Dangling links, links to directories and special files are skipped
 * and counted in the report. Files are processed
 * one at a time, each accepted rule as its own atomic transform. The first failure aborts
 * the run; files rewritten before it keep their new content.
 */
public class DirectoryReplacer {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryReplacer.class);

    private final AtomicFileReplacer fileReplacer;

    public DirectoryReplacer(AtomicFileReplacer fileReplacer) {
        this.fileReplacer = Objects.requireNonNull(fileReplacer, "File replacer cannot be null");
    }

    public BatchReport replaceInDirectory(Path root, FileRuleRegistry registry, CancellationSignal signal) {
        Objects.requireNonNull(root, "Root cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");
        Objects.requireNonNull(signal, "Signal cannot be null");

        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new ReplaceException(ErrorKind.SOURCE_READ, "Not a directory", root, null);
        }

        logger.info("Processing directory {} with {} rule(s)", root, registry.size());
        long startTime = System.nanoTime();
        BatchReport report = new BatchReport(root);

        walk(root, root, registry, signal, report);

        report.setProcessingTimeNanos(System.nanoTime() - startTime);
        logger.info("Finished {}", report);
        return report;
    }

    private void walk(Path root, Path dir, FileRuleRegistry registry, CancellationSignal signal, BatchReport report) {
        for (Path entry : listSorted(dir)) {
            signal.throwIfCancelled();

            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                walk(root, entry, registry, signal, report);
            } else if (isFileOrLinkToFile(entry)) {
                processFile(root, entry, registry, signal, report);
            } else {
                logger.debug("Skipping {}: not a regular file or a link to one", entry);
                report.entrySkipped();
            }
        }
    }

    private void processFile(Path root, Path file, FileRuleRegistry registry,
                             CancellationSignal signal, BatchReport report) {
        report.fileVisited();
        FileContext context = new FileContext(file, root);

        for (FileRule rule : registry.getAllRules()) {
            if (!accepts(rule, file)) {
                continue;
            }
            signal.throwIfCancelled();

            ProcessingResult result = fileReplacer.replaceInFile(file, rule.getRules(), context, signal);
            report.addFileReport(file, rule.getName(), result);

            logger.debug("Applied rule '{}' to {}: {} replacements",
                    rule.getName(), file, result.getReplacementCount());
        }
    }

    private static boolean isFileOrLinkToFile(Path entry) {
        if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
            return true;
        }
        // dangling links and links to directories are left alone
        return Files.isSymbolicLink(entry) && Files.isRegularFile(entry);
    }

    private static boolean accepts(FileRule rule, Path file) {
        try {
            return rule.matches(file);
        } catch (IOException e) {
            throw new ReplaceException(ErrorKind.SOURCE_READ,
                    "Rule '" + rule.getName() + "' could not inspect file", file, e);
        }
    }

    private static List<Path> listSorted(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().toList();
        } catch (IOException e) {
            throw ReplaceException.sourceRead(dir, e);
        }
    }
}

package net.kyver.relink.service;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.processor.BatchReport;
import net.kyver.relink.processor.DirectoryReplacer;
import net.kyver.relink.processor.FileRuleRegistry;
import net.kyver.relink.processor.impl.LinkRewriteRules;
import net.kyver.relink.util.PerformanceProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs link rewrites over directories below the configured work root.
 * <p>
 * Jobs run on the single threaded {@code relinkExecutor}. A directory that already has a job
 * queued or running is rejected, which keeps one writer per file.
 */
@Service
public class RelinkService {
    private static final Logger logger = LoggerFactory.getLogger(RelinkService.class);

    private final DirectoryReplacer directoryReplacer;
    private final Executor relinkExecutor;
    private final CancellationSignal shutdownSignal;
    private final PerformanceProfiler profiler;
    private final Path workRoot;
    private final Set<Path> activeDirectories = ConcurrentHashMap.newKeySet();

    @Autowired
    public RelinkService(DirectoryReplacer directoryReplacer,
                         @Qualifier("relinkExecutor") Executor relinkExecutor,
                         CancellationSignal shutdownSignal,
                         PerformanceProfiler profiler,
                         @Value("${relink.work-root:sites}") String workRoot) {
        this.directoryReplacer = directoryReplacer;
        this.relinkExecutor = relinkExecutor;
        this.shutdownSignal = shutdownSignal;
        this.profiler = profiler;
        this.workRoot = Paths.get(workRoot).toAbsolutePath().normalize();
    }

    /**
     * Resolves {@code directory} against the work root and rejects anything that escapes it,
     * lexically or through a symbolic link, or is not an existing directory.
     */
    public Path resolveDirectory(String directory) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("Directory is required");
        }
        Path resolved = workRoot.resolve(directory).toAbsolutePath().normalize();
        if (!resolved.startsWith(workRoot)) {
            throw new IllegalArgumentException("Directory is outside the work root: " + directory);
        }
        if (!Files.isDirectory(resolved, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("Directory not found: " + directory);
        }
        // a linked parent directory can still lead out of the work root
        if (!realPath(resolved, directory).startsWith(realPath(workRoot, directory))) {
            throw new IllegalArgumentException("Directory is outside the work root: " + directory);
        }
        return resolved;
    }

    private static Path realPath(Path path, String directory) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new IllegalArgumentException("Directory cannot be resolved: " + directory, e);
        }
    }

    public CompletableFuture<BatchReport> relinkAsync(String directory, String domain, String newDomain) {
        Path dir = resolveDirectory(directory);
        FileRuleRegistry rules = LinkRewriteRules.forDomain(domain, newDomain);
        if (!activeDirectories.add(dir)) {
            throw new IllegalStateException("A relink job is already running for " + directory);
        }

        logger.info("Queued relink of {} from {} to {}", dir, domain, newDomain);
        try {
            return CompletableFuture
                    .supplyAsync(() -> relink(dir, rules), relinkExecutor)
                    .whenComplete((report, error) -> activeDirectories.remove(dir));
        } catch (RuntimeException e) {
            activeDirectories.remove(dir);
            throw e;
        }
    }

    private BatchReport relink(Path dir, FileRuleRegistry rules) {
        BatchReport report = directoryReplacer.replaceInDirectory(dir, rules, shutdownSignal);
        profiler.recordOperation("relink");
        return report;
    }

    public boolean isRunning(Path directory) {
        return activeDirectories.contains(directory);
    }

    public Path getWorkRoot() {
        return workRoot;
    }
}

package net.kyver.relink.service.file;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ProcessingResult;
import net.kyver.relink.core.ReplaceEngine;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.ReplaceException.ErrorKind;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.core.stream.ChunkSink;
import net.kyver.relink.core.stream.ChunkSource;
import net.kyver.relink.core.stream.ReaderChunkSource;
import net.kyver.relink.core.stream.WriterChunkSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Rewrites a file through the replacement engine without ever exposing a partial result.
 * <p>
 * Output goes to a fresh file inside a private temporary directory and is moved over the
 * original only after the whole input has been processed. On any failure the temporary
 * directory is removed and the original stays as it was. There is no locking here; callers
 * must keep to one writer per path.
 */
public class AtomicFileReplacer {
    private static final Logger logger = LoggerFactory.getLogger(AtomicFileReplacer.class);

    private static final String TEMP_DIR_PREFIX = "relink-";
    private static final String TEMP_FILE_PREFIX = "_replace_";

    private final ReplaceEngine engine;
    private final Charset charset;
    private final Path tempRoot;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param tempRoot directory receiving the per-call temporary directories, {@code null}
     *                 for the system default
     */
    public AtomicFileReplacer(ReplaceEngine engine, Charset charset, Path tempRoot) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.charset = Objects.requireNonNull(charset, "Charset cannot be null");
        this.tempRoot = tempRoot;
    }

    public <C> ProcessingResult replaceInFile(Path file,
                                              ReplacementRules<C> rules,
                                              C context,
                                              CancellationSignal signal) {
        return transform(file, file, rules, context, signal);
    }

    /**
     * Writes the transformed content of {@code source} to {@code target}, replacing it
     * atomically. {@code source} itself is never modified.
     */
    public <C> ProcessingResult transformTo(Path source,
                                            Path target,
                                            ReplacementRules<C> rules,
                                            C context,
                                            CancellationSignal signal) {
        if (isSamePath(source, target)) {
            throw new IllegalArgumentException("Source and target are the same file: " + source);
        }
        return transform(source, target, rules, context, signal);
    }

    private <C> ProcessingResult transform(Path source,
                                           Path target,
                                           ReplacementRules<C> rules,
                                           C context,
                                           CancellationSignal signal) {
        signal.throwIfCancelled();

        Path workDir = createWorkDirectory(source);
        Path tempFile = workDir.resolve(TEMP_FILE_PREFIX
                + Long.toHexString(System.currentTimeMillis())
                + HexFormat.of().formatHex(randomBytes()));
        boolean swapped = false;

        try {
            ProcessingResult result = writeTransformed(source, tempFile, rules, context, signal);
            signal.throwIfCancelled();

            swap(tempFile, target);
            swapped = true;

            logger.debug("Replaced {} ({} replacements)", target, result.getReplacementCount());
            return result;
        } catch (RuntimeException | Error e) {
            logger.debug("Transform of {} failed, leaving it untouched: {}", source, e.getMessage());
            discard(workDir, e);
            throw e;
        } finally {
            if (swapped) {
                discard(workDir, null);
            }
        }
    }

    private <C> ProcessingResult writeTransformed(Path source,
                                                  Path tempFile,
                                                  ReplacementRules<C> rules,
                                                  C context,
                                                  CancellationSignal signal) {
        try (ChunkSource input = openSource(source, signal);
             ChunkSink output = openSink(tempFile, signal)) {
            return engine.process(input, output, rules, context, signal);
        } catch (IOException e) {
            // open failures are wrapped at the call site, only close() ends up here
            throw ReplaceException.sinkWrite(tempFile, e);
        }
    }

    private ChunkSource openSource(Path source, CancellationSignal signal) {
        try {
            return ReaderChunkSource.open(source, charset, engine.getChunkSize(), signal);
        } catch (IOException e) {
            throw ReplaceException.sourceRead(source, e);
        }
    }

    private ChunkSink openSink(Path tempFile, CancellationSignal signal) {
        try {
            return WriterChunkSink.open(tempFile, charset, signal,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ReplaceException(ErrorKind.TRANSFORM, "Failed to create temporary file", tempFile, e);
        }
    }

    private void swap(Path tempFile, Path target) {
        try {
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move into {} not supported, removing the original first", target);
                Files.deleteIfExists(target);
                Files.move(tempFile, target);
            }
        } catch (IOException e) {
            throw new ReplaceException(ErrorKind.TRANSFORM, "Failed to move result into place", target, e);
        }
    }

    private Path createWorkDirectory(Path source) {
        try {
            return tempRoot != null
                    ? Files.createTempDirectory(tempRoot, TEMP_DIR_PREFIX)
                    : Files.createTempDirectory(TEMP_DIR_PREFIX);
        } catch (IOException e) {
            throw new ReplaceException(ErrorKind.TRANSFORM, "Failed to create temporary directory", source, e);
        }
    }

    private void discard(Path workDir, Throwable failure) {
        try (var entries = Files.list(workDir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            cleanupFailed(workDir, failure, e);
        }
        try {
            Files.deleteIfExists(workDir);
        } catch (IOException e) {
            cleanupFailed(workDir, failure, e);
        }
    }

    private void cleanupFailed(Path workDir, Throwable failure, IOException cause) {
        if (failure != null) {
            failure.addSuppressed(cause);
        } else {
            logger.warn("Could not remove temporary directory {}: {}", workDir, cause.getMessage());
        }
    }

    private byte[] randomBytes() {
        byte[] bytes = new byte[4];
        random.nextBytes(bytes);
        return bytes;
    }

    private static boolean isSamePath(Path a, Path b) {
        if (a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize())) {
            return true;
        }
        try {
            return Files.exists(a) && Files.exists(b) && Files.isSameFile(a, b);
        } catch (IOException e) {
            throw new ReplaceException(ErrorKind.TRANSFORM, "Failed to compare paths", a, e);
        }
    }

    public Path getTempRoot() {
        return tempRoot;
    }

    public Charset getCharset() {
        return charset;
    }
}

package net.kyver.relink.core;

import java.nio.file.Path;

public class ReplaceException extends RuntimeException {

    public enum ErrorKind {
        SOURCE_READ,
        SINK_WRITE,
        CANCELLED,
        TRANSFORM
    }

    private final ErrorKind kind;
    private final Path path;
    private final long timestamp;

    public ReplaceException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ReplaceException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ReplaceException(ErrorKind kind, String message, Path path, Throwable cause) {
        super(path != null ? message + " (" + path + ")" : message, cause);
        this.kind = kind;
        this.path = path;
        this.timestamp = System.currentTimeMillis();
    }

    public static ReplaceException sourceRead(Path path, Throwable cause) {
        return new ReplaceException(ErrorKind.SOURCE_READ, "Failed to read input chunk", path, cause);
    }

    public static ReplaceException sinkWrite(Path path, Throwable cause) {
        return new ReplaceException(ErrorKind.SINK_WRITE, "Failed to write output chunk", path, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return kind.name();
    }

    /**
     * The file this failure relates to, or {@code null} for in-memory streams.
     */
    public Path getPath() {
        return path;
    }

    public long getTimestamp() {
        return timestamp;
    }
}

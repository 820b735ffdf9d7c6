package net.kyver.relink.processor;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Context handed to replacement callbacks while a directory is processed: the file being
 * rewritten and the root the walk started from.
 */
public final class FileContext {
    private final Path file;
    private final Path root;

    public FileContext(Path file, Path root) {
        this.file = Objects.requireNonNull(file, "File cannot be null");
        this.root = Objects.requireNonNull(root, "Root cannot be null");
    }

    public Path getFile() {
        return file;
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelativePath() {
        return root.relativize(file);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileContext)) return false;
        FileContext that = (FileContext) o;
        return file.equals(that.file) && root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, root);
    }

    @Override
    public String toString() {
        return String.format("FileContext{file=%s, root=%s}", file, root);
    }
}

package net.kyver.relink.core;

/**
 * Raised when a {@link CancellationSignal} is observed mid-scan or between chunks.
 */
public class ReplaceCancelledException extends ReplaceException {

    public ReplaceCancelledException() {
        super(ErrorKind.CANCELLED, "Replacement cancelled");
    }
}

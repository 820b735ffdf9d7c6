package net.kyver.relink.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running replacement.
 * The engine polls it, it never interrupts threads.
 */
public class CancellationSignal {

    private static final CancellationSignal NEVER = new CancellationSignal() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op signal cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return NEVER;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ReplaceCancelledException();
        }
    }
}

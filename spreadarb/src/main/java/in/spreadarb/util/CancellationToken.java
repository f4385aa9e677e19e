package in.spreadarb.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation signal.
 *
 * The engine creates one token per start and hands it to every poller and execution
 * of that run. A child token is cancelled with its parent but can also be cancelled alone.
 *
 * Usage:
 * <pre>
 * CancellationToken run = CancellationToken.linkedTo(callerToken);
 * run.onCancel(() -> scheduledTask.cancel(false));
 * ...
 * run.throwIfCancelled();
 * </pre>
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    private CancellationToken() {}

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token nobody cancels.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * New token cancelled whenever {@code parent} is.
     */
    public static CancellationToken linkedTo(CancellationToken parent) {
        CancellationToken child = new CancellationToken();
        if (parent != null) {
            parent.onCancel(child::cancel);
        }
        return child;
    }

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * Run {@code callback} on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        signal.thenRun(callback);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}

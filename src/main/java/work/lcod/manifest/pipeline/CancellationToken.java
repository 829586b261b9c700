package work.lcod.manifest.pipeline;

/**
 * Cooperative cancellation flag shared between the caller and a running import.
 */
public final class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}

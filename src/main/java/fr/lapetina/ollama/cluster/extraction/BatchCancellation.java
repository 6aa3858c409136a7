package fr.lapetina.ollama.cluster.extraction;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a batch. Chunks not yet dispatched when the
 * flag is raised complete as cancelled; chunks in flight finish normally.
 */
public final class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

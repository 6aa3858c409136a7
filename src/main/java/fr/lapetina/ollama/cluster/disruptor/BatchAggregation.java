package fr.lapetina.ollama.cluster.disruptor;

import fr.lapetina.ollama.cluster.domain.model.BatchProgress;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.extraction.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * Aggregation state of one running batch.
 *
 * Only ever touched by the single aggregation handler thread, so it needs no
 * locking. The one exception is {@link #cancelRemaining()}, called by the
 * scheduler once that thread has stopped. The future completes after the
 * listener has seen the last chunk.
 */
public final class BatchAggregation {

    private static final Logger log = LoggerFactory.getLogger(BatchAggregation.class);

    private final String batchId;
    private final ChunkResult[] results;
    private final ProgressListener listener;
    private final CompletableFuture<BatchResult> future = new CompletableFuture<>();
    private int completed;

    public BatchAggregation(String batchId, int total, ProgressListener listener) {
        this.batchId = batchId;
        this.results = new ChunkResult[total];
        this.listener = listener;
    }

    /**
     * Stores one result by its index and reports progress.
     *
     * @return true if this result completed the batch
     */
    public boolean accept(ChunkResult result) {
        int index = result.chunkIndex();
        if (results[index] != null) {
            log.warn("Duplicate completion ignored: batchId={}, chunkIndex={}", batchId, index);
            return false;
        }
        results[index] = result;
        completed++;

        BatchProgress progress = new BatchProgress(completed, results.length, index);
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: batchId={}, chunkIndex={}, error={}", batchId, index, e.getMessage());
        }

        if (completed == results.length) {
            future.complete(new BatchResult(Arrays.asList(results)));
            return true;
        }
        return false;
    }

    /**
     * Reports every chunk still without a result as cancelled, which completes
     * the batch.
     *
     * @return number of chunks cancelled
     */
    public int cancelRemaining() {
        int cancelled = 0;
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                accept(ChunkResult.cancelled(i));
                cancelled++;
            }
        }
        return cancelled;
    }

    public void fail(Throwable cause) {
        future.completeExceptionally(cause);
    }

    public String getBatchId() {
        return batchId;
    }

    public int getTotal() {
        return results.length;
    }

    public int getCompleted() {
        return completed;
    }

    public CompletableFuture<BatchResult> getFuture() {
        return future;
    }
}

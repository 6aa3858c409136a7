package fr.lapetina.ollama.cluster.domain.event;

import fr.lapetina.ollama.cluster.disruptor.BatchAggregation;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;

/**
 * Event object for the completion ring buffer: one completed chunk and the
 * batch it belongs to.
 *
 * This is a mutable holder reused across the ring buffer. It should never be
 * accessed outside the publishing worker and the aggregation handler.
 */
public final class ChunkCompletionEvent {

    private BatchAggregation batch;
    private ChunkResult result;

    public void set(BatchAggregation batch, ChunkResult result) {
        this.batch = batch;
        this.result = result;
    }

    public void clear() {
        this.batch = null;
        this.result = null;
    }

    public BatchAggregation getBatch() {
        return batch;
    }

    public ChunkResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "ChunkCompletionEvent{" +
                "batch=" + (batch != null ? batch.getBatchId() : "none") +
                ", chunkIndex=" + (result != null ? result.chunkIndex() : -1) +
                '}';
    }
}

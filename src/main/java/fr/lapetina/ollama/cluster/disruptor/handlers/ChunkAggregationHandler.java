package fr.lapetina.ollama.cluster.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.ollama.cluster.disruptor.BatchAggregation;
import fr.lapetina.ollama.cluster.domain.event.ChunkCompletionEvent;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the completion ring buffer.
 *
 * Stores each result in its batch by index, counts completions, reports
 * progress and records chunk metrics. Clears the event for reuse.
 */
public final class ChunkAggregationHandler implements EventHandler<ChunkCompletionEvent> {

    private static final Logger log = LoggerFactory.getLogger(ChunkAggregationHandler.class);

    private final MetricsRegistry metrics;

    public ChunkAggregationHandler(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onEvent(ChunkCompletionEvent event, long sequence, boolean endOfBatch) {
        try {
            BatchAggregation batch = event.getBatch();
            ChunkResult result = event.getResult();
            if (batch == null || result == null) {
                log.warn("Empty completion event: sequence={}", sequence);
                return;
            }

            if (metrics != null) {
                metrics.recordChunk(result.status());
            }

            log.debug("Chunk completed: batchId={}, chunkIndex={}, status={}, observations={}",
                    batch.getBatchId(), result.chunkIndex(), result.status(), result.observations().size());

            if (batch.accept(result)) {
                log.info("Batch completed: batchId={}, chunks={}", batch.getBatchId(), batch.getTotal());
            }
        } finally {
            event.clear();
        }
    }
}

package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.disruptor.FanOutScheduler;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.infrastructure.health.HealthProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs observation extraction jobs over the cluster: chunking, an optional
 * full health sweep, the parallel batch, then delivery to the sink.
 */
public final class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final FanOutScheduler scheduler;
    private final ObservationExtractor extractor;
    private final HealthProber prober;
    private final ChunkSource chunkSource;
    private final ObservationSink sink;
    private final boolean probeBeforeBatch;

    public ExtractionService(
            FanOutScheduler scheduler,
            ObservationExtractor extractor,
            HealthProber prober,
            ChunkSource chunkSource,
            ObservationSink sink,
            boolean probeBeforeBatch
    ) {
        this.scheduler = scheduler;
        this.extractor = extractor;
        this.prober = prober;
        this.chunkSource = chunkSource;
        this.sink = sink;
        this.probeBeforeBatch = probeBeforeBatch;
    }

    /**
     * Splits the text with the configured chunk source and extracts every chunk.
     */
    public BatchResult extractText(String text, String model, ProgressListener listener) {
        return extractChunks(chunk(text), model, listener, new BatchCancellation());
    }

    /**
     * Splits the text with the configured chunk source.
     */
    public List<String> chunk(String text) {
        return chunkSource.chunk(text);
    }

    public BatchResult extractChunks(List<String> chunks, String model, ProgressListener listener) {
        return extractChunks(chunks, model, listener, new BatchCancellation());
    }

    public BatchResult extractChunks(
            List<String> chunks,
            String model,
            ProgressListener listener,
            BatchCancellation cancellation
    ) {
        return submit(chunks, model, listener, cancellation).join();
    }

    /**
     * Starts an extraction job without waiting for it.
     *
     * @param model model override, or null to use the configured one
     */
    public CompletableFuture<BatchResult> submit(
            List<String> chunks,
            String model,
            ProgressListener listener,
            BatchCancellation cancellation
    ) {
        if (probeBeforeBatch && !chunks.isEmpty()) {
            ClusterStatus status = prober.probeAll();
            if (status.isOutage()) {
                log.warn("Starting batch with no active server: chunks={}", chunks.size());
            }
        }

        ChunkProcessor processor = model != null ? extractor.withModel(model) : extractor;
        return scheduler.submit(chunks, processor, listener, cancellation)
                .thenApply(this::deliver);
    }

    private BatchResult deliver(BatchResult result) {
        log.info("Parallel processing completed: chunks={}, extracted={}, failed={}, cancelled={}, observations={}",
                result.size(),
                result.count(ChunkResult.Status.EXTRACTED),
                result.count(ChunkResult.Status.FAILED),
                result.count(ChunkResult.Status.CANCELLED),
                result.observations().size());
        sink.accept(result.observations());
        return result;
    }
}

package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.dispatch.RetryingDispatcher;
import fr.lapetina.ollama.cluster.domain.model.ChatRequest;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.DispatchResult;
import fr.lapetina.ollama.cluster.domain.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Extracts observations from one chunk through the cluster.
 *
 * A reply that does not parse is rejected inside the dispatch loop, so it is
 * charged to its server and retried on the next one.
 */
public final class ObservationExtractor implements ChunkProcessor {

    private static final Logger log = LoggerFactory.getLogger(ObservationExtractor.class);

    private final RetryingDispatcher dispatcher;
    private final ExtractionRequestFactory requestFactory;
    private final ObservationParser parser;
    private final int maxRetries;
    private final String model;

    public ObservationExtractor(
            RetryingDispatcher dispatcher,
            ExtractionRequestFactory requestFactory,
            ObservationParser parser,
            int maxRetries
    ) {
        this(dispatcher, requestFactory, parser, maxRetries, null);
    }

    private ObservationExtractor(
            RetryingDispatcher dispatcher,
            ExtractionRequestFactory requestFactory,
            ObservationParser parser,
            int maxRetries,
            String model
    ) {
        this.dispatcher = dispatcher;
        this.requestFactory = requestFactory;
        this.parser = parser;
        this.maxRetries = maxRetries;
        this.model = model;
    }

    /**
     * Returns an extractor that requests the given model instead of the configured one.
     */
    public ObservationExtractor withModel(String model) {
        return new ObservationExtractor(dispatcher, requestFactory, parser, maxRetries, model);
    }

    @Override
    public ChunkResult process(int chunkIndex, String chunk) {
        ChatRequest request = requestFactory.create(chunk, model);
        AtomicReference<List<Observation>> parsed = new AtomicReference<>(List.of());

        DispatchResult result = dispatcher.dispatch(request, maxRetries,
                content -> parsed.set(parser.parse(content, chunk, chunkIndex)));

        if (result.isFailure()) {
            log.error("Chunk extraction failed: chunkIndex={}, failureKind={}, attempts={}, error={}",
                    chunkIndex, result.failureKind(), result.attempts(), result.errorMessage());
            return ChunkResult.failed(chunkIndex, result.failureKind(), result.errorMessage());
        }

        List<Observation> observations = parsed.get();
        log.info("Chunk extracted: chunkIndex={}, server={}, observations={}",
                chunkIndex, result.serverName(), observations.size());
        return ChunkResult.extracted(chunkIndex, observations, result.serverName());
    }
}

package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of extraction jobs started without waiting for their result.
 *
 * Callers poll a job by id for its latest progress and, once finished, its
 * result. Finished jobs are kept for the retention period, then evicted
 * lazily on the next submission or lookup. Running jobs are never evicted.
 */
public final class ExtractionJobManager {

    private static final Logger log = LoggerFactory.getLogger(ExtractionJobManager.class);

    private final ExtractionService extractionService;
    private final Duration retention;
    private final Clock clock;
    private final Map<String, ExtractionJob> jobs = new ConcurrentHashMap<>();

    public ExtractionJobManager(ExtractionService extractionService, Duration retention, Clock clock) {
        this.extractionService = extractionService;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Starts a job over pre-split chunks.
     *
     * @param model model override, or null to use the configured one
     */
    public ExtractionJob submitChunks(List<String> chunks, String model) {
        evictFinished();

        ExtractionJob job = new ExtractionJob(UUID.randomUUID().toString(), model, chunks.size(), clock.instant());
        jobs.put(job.getId(), job);
        log.info("Job submitted: jobId={}, chunks={}, model={}", job.getId(), chunks.size(), model);

        CompletableFuture<BatchResult> future;
        try {
            future = extractionService.submit(chunks, model, job::onProgress, job.getCancellation());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.error("Job failed: jobId={}, error={}", job.getId(), cause.getMessage(), cause);
                job.fail(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                        clock.instant());
            } else {
                job.complete(result, clock.instant());
                log.info("Job completed: jobId={}, chunks={}, observations={}, processingTime={}ms",
                        job.getId(), result.size(), result.observations().size(),
                        job.getProcessingTime().toMillis());
            }
        });
        return job;
    }

    /**
     * Splits the text with the service's chunk source and starts a job over it.
     */
    public ExtractionJob submitText(String text, String model) {
        return submitChunks(extractionService.chunk(text), model);
    }

    public Optional<ExtractionJob> get(String jobId) {
        evictFinished();
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Every job still in the table, oldest first.
     */
    public List<ExtractionJob> getAll() {
        evictFinished();
        return jobs.values().stream()
                .sorted(Comparator.comparing(ExtractionJob::getCreatedAt).thenComparing(ExtractionJob::getId))
                .toList();
    }

    /**
     * Cancels a running job.
     *
     * @return the job, empty if unknown
     */
    public Optional<ExtractionJob> cancel(String jobId) {
        ExtractionJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        if (!job.isFinished()) {
            job.cancel();
            log.info("Job cancellation requested: jobId={}", jobId);
        }
        return Optional.of(job);
    }

    /**
     * Removes finished jobs whose retention has expired.
     *
     * @return number of jobs removed
     */
    public int evictFinished() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (ExtractionJob job : jobs.values()) {
            Instant finishedAt = job.getFinishedAt();
            if (job.isFinished() && finishedAt != null && !finishedAt.isAfter(cutoff)
                    && jobs.remove(job.getId(), job)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted finished jobs: count={}", evicted);
        }
        return evicted;
    }

    public int size() {
        return jobs.size();
    }
}

package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.BatchProgress;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One extraction batch tracked by the {@link ExtractionJobManager}.
 *
 * Written by the aggregator thread (progress, completion) and read by any
 * caller polling the job; every mutable field is volatile. The result is
 * written before the status, so a reader seeing {@link Status#COMPLETED}
 * also sees the result.
 */
public final class ExtractionJob {

    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED
    }

    private final String id;
    private final String model;
    private final Instant createdAt;
    private final BatchCancellation cancellation = new BatchCancellation();
    private final CompletableFuture<ExtractionJob> completion = new CompletableFuture<>();

    private volatile Status status = Status.RUNNING;
    private volatile BatchProgress progress;
    private volatile BatchResult result;
    private volatile String error;
    private volatile Instant finishedAt;

    ExtractionJob(String id, String model, int total, Instant createdAt) {
        this.id = id;
        this.model = model;
        this.createdAt = createdAt;
        this.progress = new BatchProgress(0, total, -1);
    }

    void onProgress(BatchProgress progress) {
        this.progress = progress;
    }

    void complete(BatchResult result, Instant at) {
        this.result = result;
        this.finishedAt = at;
        this.status = Status.COMPLETED;
        completion.complete(this);
    }

    void fail(String error, Instant at) {
        this.error = error;
        this.finishedAt = at;
        this.status = Status.FAILED;
        completion.complete(this);
    }

    /**
     * Stops chunks not yet started; those already dispatched finish normally.
     */
    public void cancel() {
        cancellation.cancel();
    }

    BatchCancellation getCancellation() {
        return cancellation;
    }

    public String getId() {
        return id;
    }

    /**
     * Model override requested for the job, null for the configured one.
     */
    public String getModel() {
        return model;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFinished() {
        return status != Status.RUNNING;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Latest progress event. Before the first chunk completes, reports zero
     * completed chunks.
     */
    public BatchProgress getProgress() {
        return progress;
    }

    /**
     * Batch result, null until the job is {@link Status#COMPLETED}.
     */
    public BatchResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * Time from submission to completion, null while running.
     */
    public Duration getProcessingTime() {
        Instant end = finishedAt;
        return end != null ? Duration.between(createdAt, end) : null;
    }

    /**
     * Completes once the job is finished, whatever the outcome.
     */
    public CompletableFuture<ExtractionJob> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "ExtractionJob{id='" + id + "', status=" + status + ", progress=" + progress.message() + '}';
    }
}

package fr.lapetina.ollama.cluster.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ollama.cluster.domain.model.BatchProgress;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.extraction.ExtractionJob;

import java.time.Duration;
import java.time.Instant;

/**
 * State of an extraction job: latest progress, and the result once completed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResponse {

    @JsonProperty("job_id")
    private String jobId;

    private String status;
    private String model;
    private boolean cancelled;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("finished_at")
    private String finishedAt;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;

    private Progress progress;
    private ExtractResponse result;
    private String error;

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public boolean isCancelled() { return cancelled; }
    public void setCancelled(boolean cancelled) { this.cancelled = cancelled; }

    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }

    public String getFinishedAt() { return finishedAt; }
    public void setFinishedAt(String finishedAt) { this.finishedAt = finishedAt; }

    public Long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(Long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }

    public ExtractResponse getResult() { return result; }
    public void setResult(ExtractResponse result) { this.result = result; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public record Progress(int completed, int total, double percent, String message) {
        static Progress from(BatchProgress progress) {
            return new Progress(progress.completed(), progress.total(), progress.percent(), progress.message());
        }
    }

    /**
     * Creates from a job snapshot.
     *
     * @param includeResult false to leave the result out, as in job listings
     */
    public static JobResponse fromJob(ExtractionJob job, boolean includeResult) {
        // status first: a completed status guarantees the result is visible
        ExtractionJob.Status status = job.getStatus();
        JobResponse response = new JobResponse();
        response.setJobId(job.getId());
        response.setStatus(status.name());
        response.setModel(job.getModel());
        response.setCancelled(job.isCancelled());
        response.setCreatedAt(job.getCreatedAt().toString());
        Instant finishedAt = job.getFinishedAt();
        if (finishedAt != null) {
            response.setFinishedAt(finishedAt.toString());
        }
        Duration processingTime = job.getProcessingTime();
        if (processingTime != null) {
            response.setProcessingTimeMs(processingTime.toMillis());
        }
        response.setProgress(Progress.from(job.getProgress()));
        BatchResult result = job.getResult();
        if (includeResult && status == ExtractionJob.Status.COMPLETED && result != null) {
            response.setResult(ExtractResponse.fromBatch(job.getId(), result));
        }
        response.setError(job.getError());
        return response;
    }
}

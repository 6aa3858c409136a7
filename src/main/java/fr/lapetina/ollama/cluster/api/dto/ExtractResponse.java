package fr.lapetina.ollama.cluster.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.Observation;

import java.util.List;

/**
 * Extraction response: per-chunk outcome plus all observations in chunk order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractResponse {

    @JsonProperty("request_id")
    private String requestId;

    private int total;
    private long extracted;
    private long failed;
    private long cancelled;
    private List<ChunkSummary> chunks;
    private List<Observation> observations;

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }

    public long getExtracted() { return extracted; }
    public void setExtracted(long extracted) { this.extracted = extracted; }

    public long getFailed() { return failed; }
    public void setFailed(long failed) { this.failed = failed; }

    public long getCancelled() { return cancelled; }
    public void setCancelled(long cancelled) { this.cancelled = cancelled; }

    public List<ChunkSummary> getChunks() { return chunks; }
    public void setChunks(List<ChunkSummary> chunks) { this.chunks = chunks; }

    public List<Observation> getObservations() { return observations; }
    public void setObservations(List<Observation> observations) { this.observations = observations; }

    /**
     * Outcome of one chunk, without its observations.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChunkSummary(
            @JsonProperty("chunk_index") int chunkIndex,
            String status,
            int observations,
            String server,
            @JsonProperty("failure_kind") String failureKind,
            String error
    ) {
        static ChunkSummary from(ChunkResult result) {
            return new ChunkSummary(
                    result.chunkIndex(),
                    result.status().name(),
                    result.observations().size(),
                    result.serverName(),
                    result.failureKind() != null ? result.failureKind().name() : null,
                    result.errorMessage()
            );
        }
    }

    /**
     * Creates from a completed batch.
     */
    public static ExtractResponse fromBatch(String requestId, BatchResult batch) {
        ExtractResponse response = new ExtractResponse();
        response.setRequestId(requestId);
        response.setTotal(batch.size());
        response.setExtracted(batch.count(ChunkResult.Status.EXTRACTED));
        response.setFailed(batch.count(ChunkResult.Status.FAILED));
        response.setCancelled(batch.count(ChunkResult.Status.CANCELLED));
        response.setChunks(batch.results().stream().map(ChunkSummary::from).toList());
        response.setObservations(batch.observations());
        return response;
    }
}

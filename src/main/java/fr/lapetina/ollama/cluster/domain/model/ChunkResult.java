package fr.lapetina.ollama.cluster.domain.model;

import java.util.List;

/**
 * Result of processing one chunk. Always tagged with the chunk's position in the
 * submitted batch, whatever the order in which chunks completed.
 */
public record ChunkResult(
        int chunkIndex,
        Status status,
        List<Observation> observations,
        String serverName,
        FailureKind failureKind,
        String errorMessage
) {
    public ChunkResult {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative: " + chunkIndex);
        }
        observations = observations != null ? List.copyOf(observations) : List.of();
    }

    public enum Status {
        EXTRACTED,
        FAILED,
        CANCELLED
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public static ChunkResult extracted(int chunkIndex, List<Observation> observations, String serverName) {
        return new ChunkResult(chunkIndex, Status.EXTRACTED, observations, serverName, null, null);
    }

    public static ChunkResult failed(int chunkIndex, FailureKind kind, String errorMessage) {
        return new ChunkResult(chunkIndex, Status.FAILED, List.of(), null, kind, errorMessage);
    }

    public static ChunkResult cancelled(int chunkIndex) {
        return new ChunkResult(chunkIndex, Status.CANCELLED, List.of(), null, null, "Batch cancelled");
    }
}

package fr.lapetina.ollama.cluster.domain.model;

import java.util.List;

/**
 * Results of a whole batch; {@code results.get(i)} belongs to chunk {@code i}.
 */
public record BatchResult(List<ChunkResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public static BatchResult empty() {
        return new BatchResult(List.of());
    }

    public int size() {
        return results.size();
    }

    /**
     * All observations of the batch, in chunk order.
     */
    public List<Observation> observations() {
        return results.stream()
                .flatMap(result -> result.observations().stream())
                .toList();
    }

    public long count(ChunkResult.Status status) {
        return results.stream().filter(result -> result.status() == status).count();
    }
}

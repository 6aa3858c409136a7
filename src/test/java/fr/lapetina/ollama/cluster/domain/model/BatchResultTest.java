package fr.lapetina.ollama.cluster.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchResultTest {

    private static Observation observation(String text, int chunkIndex) {
        return new Observation(text, "is", List.of(new Observation.Entity("IBM", "Organization")),
                chunkIndex, 0, text.length(), false);
    }

    @Test
    @DisplayName("should flatten observations in chunk order")
    void shouldFlattenObservationsInChunkOrder() {
        BatchResult result = new BatchResult(List.of(
                ChunkResult.extracted(0, List.of(observation("a", 0), observation("b", 0)), "alpha"),
                ChunkResult.failed(1, FailureKind.OUTAGE, "No active servers available"),
                ChunkResult.extracted(2, List.of(observation("c", 2)), "beta"),
                ChunkResult.cancelled(3)
        ));

        assertThat(result.observations()).extracting(Observation::observation).containsExactly("a", "b", "c");
        assertThat(result.count(ChunkResult.Status.EXTRACTED)).isEqualTo(2);
        assertThat(result.count(ChunkResult.Status.FAILED)).isEqualTo(1);
        assertThat(result.count(ChunkResult.Status.CANCELLED)).isEqualTo(1);
    }

    @Test
    @DisplayName("should describe progress")
    void shouldDescribeProgress() {
        BatchProgress progress = new BatchProgress(3, 4, 1);

        assertThat(progress.message()).isEqualTo("Processed 3/4 chunks");
        assertThat(progress.percent()).isEqualTo(75.0);
        assertThat(progress.isDone()).isFalse();
        assertThat(new BatchProgress(4, 4, 0).isDone()).isTrue();
    }
}

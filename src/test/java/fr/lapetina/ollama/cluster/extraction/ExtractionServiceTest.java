package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.BatchProgress;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.Observation;
import fr.lapetina.ollama.cluster.infrastructure.config.ClusterConfig;
import fr.lapetina.ollama.cluster.infrastructure.config.ConfigLoader;
import fr.lapetina.ollama.cluster.support.MutableClock;
import fr.lapetina.ollama.cluster.support.StubHttpClient;
import fr.lapetina.ollama.cluster.support.TestClusterFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionServiceTest {

    private static final String REPLY = """
            [{"observation": "A paragraph", "relationship": "is",
              "entities": [{"label": "Paragraph", "category": "Concept"}]}]
            """;

    private TestClusterFactory cluster;

    @AfterEach
    void tearDown() {
        if (cluster != null) {
            cluster.close();
        }
    }

    private TestClusterFactory cluster(boolean probeBeforeBatch) {
        ClusterConfig config = new ConfigLoader("test-config.yaml").load();
        config.getExtraction().setProbeBeforeBatch(probeBeforeBatch);
        StubHttpClient stub = new StubHttpClient().onChat((server, request) -> StubHttpClient.ok(REPLY));
        cluster = TestClusterFactory.create(config, stub, new MutableClock());
        cluster.start();
        return cluster;
    }

    @Test
    @DisplayName("should chunk text into paragraphs and deliver observations to the sink")
    void shouldExtractTextIntoSink() {
        TestClusterFactory cluster = cluster(false);
        List<Observation> delivered = Collections.synchronizedList(new ArrayList<>());
        ExtractionService service = cluster.createExtractionService(new ParagraphChunker(), delivered::addAll);

        BatchResult result = service.extractText("A paragraph.\n\nAnother paragraph.", null, ProgressListener.NONE);

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.count(ChunkResult.Status.EXTRACTED)).isEqualTo(2);
        assertThat(delivered).extracting(Observation::chunkIndex).containsExactly(0, 1);
        assertThat(delivered.get(0).positionApproximate()).isFalse();
    }

    @Test
    @DisplayName("should request the configured model unless overridden")
    void shouldApplyModelOverride() {
        TestClusterFactory cluster = cluster(false);
        ExtractionService service = cluster.getExtractionService();

        service.extractChunks(List.of("one"), null, ProgressListener.NONE);
        service.extractChunks(List.of("two"), "llama3", ProgressListener.NONE);

        assertThat(cluster.getStubClient().getRequests()).extracting(r -> r.model())
                .containsExactly("gemma3:270m", "llama3");
    }

    @Test
    @DisplayName("should probe every server before a batch when enabled")
    void shouldProbeBeforeBatch() {
        TestClusterFactory cluster = cluster(true);
        List<BatchProgress> events = new ArrayList<>();

        cluster.getExtractionService().extractChunks(List.of("one", "two"), null, events::add);

        assertThat(cluster.getStubClient().getHealthCalls()).containsExactly("alpha", "beta");
        assertThat(events).hasSize(2);
    }

    @Test
    @DisplayName("should not probe for an empty batch")
    void shouldNotProbeForEmptyBatch() {
        TestClusterFactory cluster = cluster(true);

        BatchResult result = cluster.getExtractionService().extractChunks(List.of(), null, ProgressListener.NONE);

        assertThat(result.size()).isZero();
        assertThat(cluster.getStubClient().getHealthCalls()).isEmpty();
    }
}

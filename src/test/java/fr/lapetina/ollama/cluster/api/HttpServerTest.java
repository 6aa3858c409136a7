package fr.lapetina.ollama.cluster.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ollama.cluster.OllamaClusterApplication;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.support.StubHttpClient;
import fr.lapetina.ollama.cluster.support.TestClusterFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private static final String REPLY = """
            [{"observation": "Bruce Lee lived in Hong Kong.", "relationship": "lives",
              "entities": [{"label": "Bruce Lee", "category": "Person"},
                           {"label": "Hong Kong", "category": "Location"}]}]
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private StubHttpClient stub;
    private OllamaClusterApplication app;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        stub = new StubHttpClient().onChat((server, request) -> StubHttpClient.ok(REPLY));
        app = new OllamaClusterApplication(TestClusterFactory.create(stub));
        app.start();
        baseUrl = "http://127.0.0.1:" + app.getHttpServer().getPort();
    }

    @AfterEach
    void tearDown() {
        app.close();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Polls a job until it leaves RUNNING, or five seconds have passed.
     */
    private JsonNode awaitJob(String jobId) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            HttpResponse<String> response = get("/v1/jobs/" + jobId);
            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            if (!"RUNNING".equals(body.get("status").asText()) || System.nanoTime() > deadline) {
                return body;
            }
            Thread.sleep(20);
        }
    }

    @Nested
    @DisplayName("POST /v1/extract")
    class ExtractTests {

        @Test
        @DisplayName("should extract pre-split chunks")
        void shouldExtractChunks() throws Exception {
            HttpResponse<String> response = post("/v1/extract",
                    "{\"chunks\": [\"Bruce Lee lived in Hong Kong.\", \"Nothing here.\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("request_id").asText()).isNotBlank();
            assertThat(body.get("total").asInt()).isEqualTo(2);
            assertThat(body.get("extracted").asInt()).isEqualTo(2);
            assertThat(body.get("chunks").get(1).get("chunk_index").asInt()).isEqualTo(1);
            assertThat(body.get("observations")).hasSize(2);

            JsonNode first = body.get("observations").get(0);
            assertThat(first.get("chunk_index").asInt()).isZero();
            assertThat(first.get("position_approximate").asBoolean()).isFalse();
            assertThat(body.get("observations").get(1).get("position_approximate").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should split raw text into paragraphs")
        void shouldExtractText() throws Exception {
            HttpResponse<String> response = post("/v1/extract",
                    "{\"text\": \"First.\\n\\nSecond.\\n\\nThird.\", \"model\": \"llama3\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).get("total").asInt()).isEqualTo(3);
            assertThat(stub.getRequests()).allSatisfy(r -> assertThat(r.model()).isEqualTo("llama3"));
        }

        @Test
        @DisplayName("should report failed chunks in a successful response")
        void shouldReportFailedChunks() throws Exception {
            stub.failAllWith(FailureKind.TIMEOUT);

            HttpResponse<String> response = post("/v1/extract", "{\"chunks\": [\"a\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode chunk = mapper.readTree(response.body()).get("chunks").get(0);
            assertThat(chunk.get("status").asText()).isEqualTo("FAILED");
            assertThat(chunk.get("failure_kind").asText()).isEqualTo("TIMEOUT");
        }

        @Test
        @DisplayName("should reject invalid JSON")
        void shouldRejectInvalidJson() throws Exception {
            HttpResponse<String> response = post("/v1/extract", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(response.body()).get("error").asText()).startsWith("Invalid JSON");
        }

        @Test
        @DisplayName("should require exactly one of chunks or text")
        void shouldRequireOneInput() throws Exception {
            assertThat(post("/v1/extract", "{}").statusCode()).isEqualTo(400);
            assertThat(post("/v1/extract", "{\"chunks\": [\"a\"], \"text\": \"b\"}").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should reject other methods")
        void shouldRejectGet() throws Exception {
            assertThat(get("/v1/extract").statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("/v1/jobs")
    class JobsTests {

        @Test
        @DisplayName("should start a job and report its progress and result")
        void shouldRunJob() throws Exception {
            HttpResponse<String> submitted = post("/v1/jobs",
                    "{\"chunks\": [\"Bruce Lee lived in Hong Kong.\", \"Nothing here.\"]}");

            assertThat(submitted.statusCode()).isEqualTo(202);
            JsonNode accepted = mapper.readTree(submitted.body());
            String jobId = accepted.get("job_id").asText();
            assertThat(jobId).isNotBlank();
            assertThat(accepted.get("progress").get("total").asInt()).isEqualTo(2);

            JsonNode job = awaitJob(jobId);

            assertThat(job.get("status").asText()).isEqualTo("COMPLETED");
            JsonNode progress = job.get("progress");
            assertThat(progress.get("completed").asInt()).isEqualTo(2);
            assertThat(progress.get("percent").asDouble()).isEqualTo(100.0);
            assertThat(progress.get("message").asText()).isEqualTo("Processed 2/2 chunks");
            assertThat(job.has("finished_at")).isTrue();

            JsonNode result = job.get("result");
            assertThat(result.get("request_id").asText()).isEqualTo(jobId);
            assertThat(result.get("total").asInt()).isEqualTo(2);
            assertThat(result.get("extracted").asInt()).isEqualTo(2);
            assertThat(result.get("observations")).hasSize(2);
        }

        @Test
        @DisplayName("should list jobs without their results")
        void shouldListJobs() throws Exception {
            String jobId = mapper.readTree(post("/v1/jobs", "{\"text\": \"One.\\n\\nTwo.\"}").body())
                    .get("job_id").asText();
            awaitJob(jobId);

            HttpResponse<String> response = get("/v1/jobs");

            assertThat(response.statusCode()).isEqualTo(200);
            List<String> ids = new ArrayList<>();
            for (JsonNode job : mapper.readTree(response.body()).get("jobs")) {
                ids.add(job.get("job_id").asText());
                assertThat(job.has("result")).isFalse();
            }
            assertThat(ids).containsExactly(jobId);
        }

        @Test
        @DisplayName("should cancel the chunks of a running job not yet started")
        void shouldCancelJob() throws Exception {
            CountDownLatch entered = new CountDownLatch(2);
            CountDownLatch release = new CountDownLatch(1);
            stub.onChat((server, request) -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return StubHttpClient.ok(REPLY);
            });

            String jobId = mapper.readTree(post("/v1/jobs", "{\"chunks\": [\"a\", \"b\", \"c\", \"d\"]}").body())
                    .get("job_id").asText();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            HttpResponse<String> cancelled = delete("/v1/jobs/" + jobId);
            assertThat(cancelled.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(cancelled.body()).get("cancelled").asBoolean()).isTrue();
            release.countDown();

            JsonNode job = awaitJob(jobId);
            assertThat(job.get("status").asText()).isEqualTo("COMPLETED");
            assertThat(job.get("result").get("extracted").asInt()).isEqualTo(2);
            assertThat(job.get("result").get("cancelled").asInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("should answer 404 for an unknown job")
        void shouldRejectUnknownJob() throws Exception {
            assertThat(get("/v1/jobs/missing").statusCode()).isEqualTo(404);
            assertThat(delete("/v1/jobs/missing").statusCode()).isEqualTo(404);
            assertThat(get("/v1/jobsmissing").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should validate the submitted request")
        void shouldValidateSubmission() throws Exception {
            assertThat(post("/v1/jobs", "{not json").statusCode()).isEqualTo(400);
            assertThat(post("/v1/jobs", "{}").statusCode()).isEqualTo(400);
            assertThat(app.getFactory().getJobManager().size()).isZero();
        }
    }

    @Nested
    @DisplayName("Health and administration")
    class HealthTests {

        @Test
        @DisplayName("should report UP while a server is active")
        void shouldReportUp() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("status").asText()).isEqualTo("UP");
            assertThat(body.get("cluster").get("totalServers").asInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("should report DOWN with 503 after a failed health check of every server")
        void shouldReportDown() throws Exception {
            stub.setDefaultHealthy(false);

            HttpResponse<String> check = post("/admin/health-check", "");
            assertThat(check.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(check.body()).get("status").asText()).isEqualTo("DOWN");

            assertThat(get("/health").statusCode()).isEqualTo(503);

            stub.setDefaultHealthy(true);
            HttpResponse<String> reconnect = post("/admin/reconnect", "");
            assertThat(mapper.readTree(reconnect.body()).get("cluster").get("activeServers").asInt())
                    .isEqualTo(2);
            assertThat(get("/health").statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            post("/v1/extract", "{\"chunks\": [\"a\"]}");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("test_cluster_dispatch_attempts_total");
            assertThat(response.body()).contains("test_cluster_chunks_total");
        }

        @Test
        @DisplayName("should answer 404 for unknown admin paths")
        void shouldRejectUnknownAdminPath() throws Exception {
            assertThat(post("/admin/unknown", "").statusCode()).isEqualTo(404);
        }
    }
}

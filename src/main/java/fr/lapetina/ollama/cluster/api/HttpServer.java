package fr.lapetina.ollama.cluster.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.ollama.cluster.api.dto.ExtractRequest;
import fr.lapetina.ollama.cluster.api.dto.ExtractResponse;
import fr.lapetina.ollama.cluster.api.dto.JobResponse;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.extraction.ExtractionJob;
import fr.lapetina.ollama.cluster.extraction.ExtractionJobManager;
import fr.lapetina.ollama.cluster.extraction.ExtractionService;
import fr.lapetina.ollama.cluster.extraction.ProgressListener;
import fr.lapetina.ollama.cluster.infrastructure.health.ClusterRegistry;
import fr.lapetina.ollama.cluster.infrastructure.health.HealthProber;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/extract - Extract observations from chunks or raw text
 * - POST /v1/jobs - Start an extraction job, returns its id
 * - GET /v1/jobs - List known jobs
 * - GET /v1/jobs/{id} - Job progress, and the result once completed
 * - DELETE /v1/jobs/{id} - Cancel a running job
 * - GET /health - Cluster status, 503 when no server is active
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reconnect - Probe inactive servers now
 * - POST /admin/health-check - Probe every server now
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ExtractionService extractionService;
    private final ExtractionJobManager jobManager;
    private final ClusterRegistry registry;
    private final HealthProber prober;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            ExtractionService extractionService,
            ExtractionJobManager jobManager,
            ClusterRegistry registry,
            HealthProber prober,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.extractionService = extractionService;
        this.jobManager = jobManager;
        this.registry = registry;
        this.prober = prober;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        this.executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/v1/extract", new ExtractHandler());
        server.createContext("/v1/jobs", new JobsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== EXTRACT HANDLER ====================

    private class ExtractHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                ExtractRequest request = readRequest(exchange);
                if (request == null) {
                    return;
                }

                ProgressListener progress = p -> log.info("{} ({}%)", p.message(), Math.round(p.percent()));
                BatchResult result = request.getChunks() != null
                        ? extractionService.extractChunks(request.getChunks(), request.getModel(), progress)
                        : extractionService.extractText(request.getText(), request.getModel(), progress);

                sendJson(exchange, 200, ExtractResponse.fromBatch(requestId, result));

            } catch (Exception e) {
                log.error("Error handling extraction request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== JOBS HANDLER ====================

    private class JobsHandler implements HttpHandler {
        private static final String BASE_PATH = "/v1/jobs";

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            if (!path.equals(BASE_PATH) && !path.startsWith(BASE_PATH + "/")) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            String jobId = path.length() > BASE_PATH.length() + 1 ? path.substring(BASE_PATH.length() + 1) : null;

            try {
                if (jobId == null) {
                    if ("POST".equalsIgnoreCase(method)) {
                        submitJob(exchange);
                    } else if ("GET".equalsIgnoreCase(method)) {
                        List<JobResponse> jobs = jobManager.getAll().stream()
                                .map(job -> JobResponse.fromJob(job, false))
                                .toList();
                        sendJson(exchange, 200, Map.of("jobs", jobs));
                    } else {
                        sendError(exchange, 405, "Method Not Allowed");
                    }
                    return;
                }

                MDC.put("jobId", jobId);
                Optional<ExtractionJob> job;
                if ("GET".equalsIgnoreCase(method)) {
                    job = jobManager.get(jobId);
                } else if ("DELETE".equalsIgnoreCase(method)) {
                    job = jobManager.cancel(jobId);
                } else {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                if (job.isPresent()) {
                    sendJson(exchange, 200, JobResponse.fromJob(job.get(), true));
                } else {
                    sendError(exchange, 404, "Unknown job: " + jobId);
                }
            } catch (Exception e) {
                log.error("Error handling job request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void submitJob(HttpExchange exchange) throws IOException {
            ExtractRequest request = readRequest(exchange);
            if (request == null) {
                return;
            }
            ExtractionJob job = request.getChunks() != null
                    ? jobManager.submitChunks(request.getChunks(), request.getModel())
                    : jobManager.submitText(request.getText(), request.getModel());
            MDC.put("jobId", job.getId());
            sendJson(exchange, 202, JobResponse.fromJob(job, true));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            ClusterStatus status = registry.snapshot();
            sendJson(exchange, status.isOutage() ? 503 : 200, statusBody(status));
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/reconnect") && "POST".equals(method)) {
                    ClusterStatus status = prober.forceReconnect();
                    sendJson(exchange, 200, statusBody(status));
                } else if (path.equals("/admin/health-check") && "POST".equals(method)) {
                    ClusterStatus status = prober.probeAll();
                    sendJson(exchange, 200, statusBody(status));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }
    }

    // ==================== HELPER METHODS ====================

    /**
     * Reads and validates an extraction request, answering 400 when unusable.
     *
     * @return the request, or null once an error response has been sent
     */
    private ExtractRequest readRequest(HttpExchange exchange) throws IOException {
        ExtractRequest request;
        try (InputStream is = exchange.getRequestBody()) {
            request = objectMapper.readValue(is, ExtractRequest.class);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Invalid JSON: " + e.getOriginalMessage());
            return null;
        }

        String validationError = request.validate();
        if (validationError != null) {
            sendError(exchange, 400, validationError);
            return null;
        }
        return request;
    }

    private static Map<String, Object> statusBody(ClusterStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.isOutage() ? "DOWN" : "UP");
        body.put("timestamp", System.currentTimeMillis());
        body.put("cluster", status);
        return body;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}

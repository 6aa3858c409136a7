package fr.lapetina.ollama.cluster.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ollama.cluster.domain.model.ChatReply;
import fr.lapetina.ollama.cluster.domain.model.ChatRequest;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for communicating with Ollama servers.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Returned futures never
 * complete exceptionally: every transport or protocol problem is converted into
 * a {@link ChatReply} carrying a {@link FailureKind}.
 */
public class OllamaHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaHttpClient.class);

    static final String TAGS_PATH = "/api/tags";
    static final String CHAT_PATH = "/api/chat";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OllamaHttpClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaHttpClient() {
        this(Duration.ofSeconds(10));
    }

    /**
     * Sends a chat request to the specified server, bounded by the server's timeout.
     *
     * @param server  Target Ollama server
     * @param request Chat request
     * @return CompletableFuture with the reply, successful or not
     */
    public CompletableFuture<ChatReply> sendChat(ServerRecord server, ChatRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(endpoint(server, CHAT_PATH))
                    .timeout(server.getTimeout())
                    .header("Content-Type", "application/json")
                    .header("X-Request-ID", request.requestId())
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(server, request)))
                    .build();
        } catch (Exception e) {
            log.error("Failed to build request: server={}, requestId={}", server.getName(), request.requestId(), e);
            return CompletableFuture.completedFuture(ChatReply.failure(
                    FailureKind.INTERNAL_ERROR, 0, Duration.ZERO, "Failed to build request: " + e.getMessage()));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: server={}, requestId={}, model={}, endpoint={}",
                server.getName(), request.requestId(), request.modelFor(server), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(server, request, response, startTime))
                .exceptionally(ex -> handleException(server, request, ex, startTime));
    }

    String buildRequestBody(ServerRecord server, ChatRequest request) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.modelFor(server));

        List<Map<String, String>> messages = request.messages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
        body.put("messages", messages);
        body.put("stream", false);
        body.putAll(request.parameters());

        if (request.format() != null) {
            body.put("format", request.format());
        }

        return objectMapper.writeValueAsString(body);
    }

    private ChatReply handleResponse(
            ServerRecord server,
            ChatRequest request,
            HttpResponse<String> response,
            Instant startTime
    ) {
        Duration latency = Duration.between(startTime, Instant.now());
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            log.warn("Request failed on {} with status {}: requestId={}, latencyMs={}",
                    server.getName(), statusCode, request.requestId(), latency.toMillis());
            return ChatReply.failure(FailureKind.PROTOCOL_FAILURE, statusCode, latency,
                    extractError(response.body(), statusCode));
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode content = root.path("message").path("content");
            if (!content.isTextual()) {
                log.warn("Reply without message content: server={}, requestId={}", server.getName(), request.requestId());
                return ChatReply.failure(FailureKind.MALFORMED_OUTPUT, statusCode, latency,
                        "Reply has no message.content");
            }
            return ChatReply.success(content.asText(), statusCode, latency);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse reply: server={}, requestId={}, error={}",
                    server.getName(), request.requestId(), e.getOriginalMessage());
            return ChatReply.failure(FailureKind.MALFORMED_OUTPUT, statusCode, latency,
                    "Failed to parse reply: " + e.getOriginalMessage());
        }
    }

    private String extractError(String body, int statusCode) {
        String errorMessage = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return errorMessage;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                errorMessage = errorMessage + ": " + error.asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: status={}", statusCode);
        }
        return errorMessage;
    }

    private ChatReply handleException(ServerRecord server, ChatRequest request, Throwable ex, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        Throwable cause = unwrap(ex);
        FailureKind kind = classifyException(cause);

        if (kind == FailureKind.TIMEOUT) {
            log.warn("Request timeout on {}: requestId={}, timeoutMs={}",
                    server.getName(), request.requestId(), server.getTimeout().toMillis());
        } else {
            log.warn("Request error on {}: requestId={}, errorType={}, error={}",
                    server.getName(), request.requestId(), cause.getClass().getSimpleName(), cause.getMessage());
        }

        return ChatReply.failure(kind, 0, latency, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public static FailureKind classifyException(Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException
                || cause instanceof ConnectException
                || cause instanceof UnknownHostException) {
            return FailureKind.UNREACHABLE;
        }
        if (cause instanceof HttpTimeoutException
                || cause instanceof java.util.concurrent.TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return FailureKind.PROTOCOL_FAILURE;
        }
        return FailureKind.INTERNAL_ERROR;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Performs a health check against a server: {@code GET /api/tags}, healthy on 200.
     */
    public CompletableFuture<Boolean> healthCheck(ServerRecord server, Duration timeout) {
        URI uri = endpoint(server, TAGS_PATH);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("Health check started: server={}, uri={}", server.getName(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() == 200;
                    if (!healthy) {
                        log.warn("Server {} returned status {}", server.getName(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    log.warn("Health check failed for {}: {}", server.getName(),
                            cause.getClass().getSimpleName() + ": " + cause.getMessage());
                    return false;
                });
    }

    private static URI endpoint(ServerRecord server, String path) {
        return URI.create(server.getBaseUrl().toString() + path);
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}

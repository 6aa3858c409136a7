package fr.lapetina.ollama.cluster.dispatch;

import fr.lapetina.ollama.cluster.domain.model.ChatReply;
import fr.lapetina.ollama.cluster.domain.model.ChatRequest;
import fr.lapetina.ollama.cluster.domain.model.DispatchResult;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Sends one logical request to the cluster, failing over to other servers.
 *
 * Each attempt asks the selector for a server. A failed attempt is charged to
 * the server that produced it, which is deactivated once its error count
 * reaches its threshold. When no server is active the dispatch fails at once
 * with {@link FailureKind#OUTAGE}, without any HTTP call.
 */
public class RetryingDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RetryingDispatcher.class);

    static final String MDC_SERVER = "server";

    private final ServerSelector selector;
    private final OllamaHttpClient httpClient;
    private final MetricsRegistry metrics;
    private final int defaultMaxRetries;

    public RetryingDispatcher(
            ServerSelector selector,
            OllamaHttpClient httpClient,
            MetricsRegistry metrics,
            int defaultMaxRetries
    ) {
        if (defaultMaxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + defaultMaxRetries);
        }
        this.selector = selector;
        this.httpClient = httpClient;
        this.metrics = metrics;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public DispatchResult dispatch(ChatRequest request) {
        return dispatch(request, defaultMaxRetries, ResponseValidator.ACCEPT_ALL);
    }

    public DispatchResult dispatch(ChatRequest request, int maxRetries) {
        return dispatch(request, maxRetries, ResponseValidator.ACCEPT_ALL);
    }

    /**
     * Dispatches a request, making at most {@code maxRetries} attempts.
     *
     * @param validator applied to the content of every successful reply
     * @return the first accepted reply, or a failure carrying the last failure kind
     */
    public DispatchResult dispatch(ChatRequest request, int maxRetries, ResponseValidator validator) {
        String requestId = request.requestId();
        FailureKind lastKind = null;
        String lastError = null;
        String lastServer = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Optional<ServerRecord> selected = selector.nextAvailable();
            if (selected.isEmpty()) {
                log.error("No server available for request: requestId={}, attempt={}", requestId, attempt);
                return DispatchResult.failure(requestId, lastServer, attempt - 1,
                        FailureKind.OUTAGE, "No active servers available");
            }

            ServerRecord server = selected.get();
            lastServer = server.getName();
            MDC.put(MDC_SERVER, server.getName());
            try {
                log.info("Sending request: requestId={}, server={}, model={}, attempt={}/{}",
                        requestId, server.getName(), request.modelFor(server), attempt, maxRetries);

                ChatReply reply = validate(send(server, request), validator);
                recordAttempt(server, reply);

                if (reply.isSuccess()) {
                    if (server.recordDispatchSuccess(reply.latency())) {
                        log.info("Server back online: server={}", server.getName());
                    }
                    log.info("Request completed: requestId={}, server={}, attempt={}, latencyMs={}",
                            requestId, server.getName(), attempt, reply.latency().toMillis());
                    return DispatchResult.success(requestId, reply.content(), server.getName(),
                            attempt, reply.latency());
                }

                lastKind = reply.failureKind();
                lastError = reply.errorMessage();

                if (!lastKind.isServerFault()) {
                    log.error("Request aborted on local error: requestId={}, server={}, error={}",
                            requestId, server.getName(), lastError);
                    return DispatchResult.failure(requestId, server.getName(), attempt, lastKind, lastError);
                }

                ServerRecord.FailureRecord failure = server.recordDispatchFailure();
                log.warn("Request failed: requestId={}, server={}, attempt={}/{}, failureKind={}, errorCount={}/{}, error={}",
                        requestId, server.getName(), attempt, maxRetries, lastKind,
                        failure.errorCount(), server.getMaxErrors(), lastError);
                if (failure.deactivated()) {
                    log.warn("Server deactivated: server={}, errorCount={}", server.getName(), failure.errorCount());
                }
            } finally {
                MDC.remove(MDC_SERVER);
            }
        }

        log.error("All retries exhausted: requestId={}, attempts={}, failureKind={}", requestId, maxRetries, lastKind);
        return DispatchResult.failure(requestId, lastServer, maxRetries, lastKind, lastError);
    }

    private ChatReply send(ServerRecord server, ChatRequest request) {
        try {
            return httpClient.sendChat(server, request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ChatReply.failure(OllamaHttpClient.classifyException(cause), 0, Duration.ZERO,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private static ChatReply validate(ChatReply reply, ResponseValidator validator) {
        if (!reply.isSuccess()) {
            return reply;
        }
        try {
            validator.validate(reply.content());
            return reply;
        } catch (MalformedOutputException e) {
            return ChatReply.failure(FailureKind.MALFORMED_OUTPUT, reply.statusCode(), reply.latency(), e.getMessage());
        }
    }

    private void recordAttempt(ServerRecord server, ChatReply reply) {
        if (metrics == null) {
            return;
        }
        metrics.recordAttempt(server.getName(), reply.failureKind());
        if (reply.isSuccess()) {
            metrics.recordLatency(server.getName(), reply.latency());
        }
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }
}

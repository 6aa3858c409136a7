package fr.lapetina.ollama.cluster.domain.model;

import java.time.Duration;

/**
 * Result of a single HTTP exchange with one server.
 */
public record ChatReply(
        String content,
        int statusCode,
        Duration latency,
        FailureKind failureKind,
        String errorMessage
) {
    public boolean isSuccess() {
        return failureKind == null;
    }

    public static ChatReply success(String content, int statusCode, Duration latency) {
        return new ChatReply(content, statusCode, latency, null, null);
    }

    public static ChatReply failure(FailureKind kind, int statusCode, Duration latency, String errorMessage) {
        return new ChatReply(null, statusCode, latency, kind, errorMessage);
    }
}

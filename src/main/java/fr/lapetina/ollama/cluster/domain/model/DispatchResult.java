package fr.lapetina.ollama.cluster.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of dispatching one logical request through the cluster.
 * Immutable and thread-safe.
 *
 * <p>On success {@code content} holds the reply's {@code message.content} and
 * {@code failureKind} is null. On failure {@code failureKind} tells why the last
 * attempt failed, or {@link FailureKind#OUTAGE} if no server was available.
 */
public record DispatchResult(
        String requestId,
        String content,
        String serverName,
        int attempts,
        Duration latency,
        FailureKind failureKind,
        String errorMessage
) {
    public DispatchResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    public static DispatchResult success(
            String requestId,
            String content,
            String serverName,
            int attempts,
            Duration latency
    ) {
        return new DispatchResult(requestId, content, serverName, attempts, latency, null, null);
    }

    public static DispatchResult failure(
            String requestId,
            String serverName,
            int attempts,
            FailureKind failureKind,
            String errorMessage
    ) {
        return new DispatchResult(
                requestId, null, serverName, attempts, Duration.ZERO,
                Objects.requireNonNull(failureKind, "Failure kind is required"), errorMessage
        );
    }
}

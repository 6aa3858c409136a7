package fr.lapetina.ollama.cluster.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A logical chat request to be dispatched to whichever server the cluster picks.
 * Immutable and thread-safe.
 *
 * <p>{@code model} may be null, in which case each server's configured model is used.
 * {@code parameters} are written at the top level of the request body, next to
 * {@code model} and {@code messages}.
 */
public record ChatRequest(
        String requestId,
        String model,
        List<Message> messages,
        JsonNode format,
        Map<String, Object> parameters
) {
    public ChatRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message must be provided");
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        messages = List.copyOf(messages);
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    /**
     * Chat message for conversation-style requests.
     */
    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    /**
     * Model to send to the given server.
     */
    public String modelFor(ServerRecord server) {
        return model != null ? model : server.getModel();
    }

    public static ChatRequest of(String model, List<Message> messages) {
        return new ChatRequest(null, model, messages, null, null);
    }
}

package fr.lapetina.ollama.cluster.support;

import fr.lapetina.ollama.cluster.domain.model.ChatReply;
import fr.lapetina.ollama.cluster.domain.model.ChatRequest;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.infrastructure.http.OllamaHttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Stub HTTP client for testing. Replies are scripted per server name and every
 * call is recorded in order.
 */
public class StubHttpClient extends OllamaHttpClient {

    private final Map<String, BiFunction<ServerRecord, ChatRequest, ChatReply>> chatResponders = new ConcurrentHashMap<>();
    private final Map<String, Boolean> health = new ConcurrentHashMap<>();
    private final List<String> chatCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<String> healthCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<ChatRequest> requests = Collections.synchronizedList(new ArrayList<>());

    private volatile BiFunction<ServerRecord, ChatRequest, ChatReply> defaultResponder =
            (server, request) -> ChatReply.success("[]", 200, Duration.ofMillis(5));
    private volatile boolean defaultHealthy = true;

    public StubHttpClient() {
        super(Duration.ofSeconds(1));
    }

    public static ChatReply ok(String content) {
        return ChatReply.success(content, 200, Duration.ofMillis(5));
    }

    public static ChatReply fail(FailureKind kind) {
        return ChatReply.failure(kind, kind == FailureKind.PROTOCOL_FAILURE ? 500 : 0, Duration.ofMillis(5),
                "stubbed " + kind);
    }

    public StubHttpClient onChat(BiFunction<ServerRecord, ChatRequest, ChatReply> responder) {
        this.defaultResponder = responder;
        return this;
    }

    public StubHttpClient onChat(String server, BiFunction<ServerRecord, ChatRequest, ChatReply> responder) {
        chatResponders.put(server, responder);
        return this;
    }

    public StubHttpClient replyWith(String server, String content) {
        return onChat(server, (s, r) -> ok(content));
    }

    public StubHttpClient failWith(String server, FailureKind kind) {
        return onChat(server, (s, r) -> fail(kind));
    }

    public StubHttpClient failAllWith(FailureKind kind) {
        chatResponders.clear();
        return onChat((s, r) -> fail(kind));
    }

    public StubHttpClient setHealthy(String server, boolean healthy) {
        health.put(server, healthy);
        return this;
    }

    public StubHttpClient setDefaultHealthy(boolean healthy) {
        this.defaultHealthy = healthy;
        return this;
    }

    public List<String> getChatCalls() {
        synchronized (chatCalls) {
            return List.copyOf(chatCalls);
        }
    }

    public List<String> getHealthCalls() {
        synchronized (healthCalls) {
            return List.copyOf(healthCalls);
        }
    }

    public List<ChatRequest> getRequests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public void clearCalls() {
        chatCalls.clear();
        healthCalls.clear();
        requests.clear();
    }

    @Override
    public CompletableFuture<ChatReply> sendChat(ServerRecord server, ChatRequest request) {
        chatCalls.add(server.getName());
        requests.add(request);
        BiFunction<ServerRecord, ChatRequest, ChatReply> responder =
                chatResponders.getOrDefault(server.getName(), defaultResponder);
        try {
            return CompletableFuture.completedFuture(responder.apply(server, request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Boolean> healthCheck(ServerRecord server, Duration timeout) {
        healthCalls.add(server.getName());
        return CompletableFuture.completedFuture(health.getOrDefault(server.getName(), defaultHealthy));
    }
}

package fr.lapetina.ollama.cluster.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one server, read by status consumers.
 * {@code responseTime} and {@code lastCheck} are null until first measured.
 * {@code maxRetries} is the configured per-server value; dispatch itself is
 * bounded by the cluster-wide {@code retry.maxRetries}.
 */
public record ServerStatus(
        String name,
        String url,
        String model,
        int maxRetries,
        boolean active,
        int errorCount,
        int maxErrors,
        Duration responseTime,
        Instant lastCheck
) {
}

package fr.lapetina.ollama.cluster.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the whole cluster.
 */
public record ClusterStatus(
        int totalServers,
        int activeServers,
        Instant lastHealthCheck,
        Duration healthCheckInterval,
        List<ServerStatus> servers
) {
    public ClusterStatus {
        servers = List.copyOf(servers);
    }

    public boolean isOutage() {
        return activeServers == 0;
    }
}

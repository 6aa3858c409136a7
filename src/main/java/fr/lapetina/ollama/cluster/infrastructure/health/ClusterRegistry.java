package fr.lapetina.ollama.cluster.infrastructure.health;

import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.domain.model.ServerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of the cluster's Ollama servers.
 *
 * The server list is fixed at construction; its order defines the round-robin
 * sequence. Health lives in each {@link ServerRecord}. The registry also owns
 * the sweep schedule used for lazy reconciliation of inactive servers.
 */
public final class ClusterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClusterRegistry.class);

    private final List<ServerRecord> servers;
    private final Duration sweepInterval;
    private final Clock clock;

    // EPOCH until the first sweep, so the first selection reconciles
    private final AtomicReference<Instant> lastSweep = new AtomicReference<>(Instant.EPOCH);

    public ClusterRegistry(List<ServerRecord> servers, Duration sweepInterval, Clock clock) {
        Set<String> names = new HashSet<>();
        for (ServerRecord server : servers) {
            if (!names.add(server.getName())) {
                throw new IllegalArgumentException("Duplicate server name: " + server.getName());
            }
        }
        this.servers = List.copyOf(servers);
        this.sweepInterval = sweepInterval;
        this.clock = clock;
        log.info("Cluster registry created: servers={}, sweepInterval={}", this.servers.size(), sweepInterval);
    }

    public ClusterRegistry(List<ServerRecord> servers, Duration sweepInterval) {
        this(servers, sweepInterval, Clock.systemUTC());
    }

    /**
     * Gets all servers, in configuration order.
     */
    public List<ServerRecord> getAllServers() {
        return servers;
    }

    /**
     * Gets the servers currently active, in configuration order.
     */
    public List<ServerRecord> getActiveServers() {
        return servers.stream()
                .filter(ServerRecord::isActive)
                .toList();
    }

    /**
     * Gets the servers currently inactive, in configuration order.
     */
    public List<ServerRecord> getInactiveServers() {
        return servers.stream()
                .filter(server -> !server.isActive())
                .toList();
    }

    public Optional<ServerRecord> getServer(String name) {
        return servers.stream()
                .filter(server -> server.getName().equals(name))
                .findFirst();
    }

    public int size() {
        return servers.size();
    }

    public int activeCount() {
        return (int) servers.stream().filter(ServerRecord::isActive).count();
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Time of the last sweep, or null if none ran yet.
     */
    public Instant getLastSweep() {
        Instant last = lastSweep.get();
        return Instant.EPOCH.equals(last) ? null : last;
    }

    /**
     * Claims the next lazy sweep if more than the sweep interval elapsed since
     * the last one. Only one of several concurrent callers wins the claim.
     *
     * @return true if the caller must run the sweep
     */
    public boolean tryClaimSweep() {
        Instant last = lastSweep.get();
        Instant now = clock.instant();
        if (Duration.between(last, now).compareTo(sweepInterval) <= 0) {
            return false;
        }
        return lastSweep.compareAndSet(last, now);
    }

    /**
     * Stamps the sweep time with the current instant.
     */
    public void markSweep() {
        lastSweep.set(clock.instant());
    }

    /**
     * Returns a consistent-per-server snapshot of the cluster.
     */
    public ClusterStatus snapshot() {
        List<ServerStatus> statuses = servers.stream()
                .map(ServerRecord::snapshot)
                .toList();
        int active = (int) statuses.stream().filter(ServerStatus::active).count();
        return new ClusterStatus(servers.size(), active, getLastSweep(), sweepInterval, statuses);
    }
}

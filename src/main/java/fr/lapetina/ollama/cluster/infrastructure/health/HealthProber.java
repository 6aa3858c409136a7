package fr.lapetina.ollama.cluster.infrastructure.health;

import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Health prober for Ollama servers.
 *
 * A probe first checks network reachability of the host, then calls
 * {@code GET /api/tags}. Any failure deactivates the server and increments its
 * error count; a success reactivates it and resets the count.
 *
 * Sweeps run lazily from the selector by default. A background sweep of the
 * inactive servers can be enabled with {@link #start()}.
 */
public class HealthProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final ClusterRegistry registry;
    private final OllamaHttpClient httpClient;
    private final ReachabilityChecker reachabilityChecker;
    private final MetricsRegistry metrics;
    private final Duration probeTimeout;
    private final int reachabilityTimeoutMs;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthProber(
            ClusterRegistry registry,
            OllamaHttpClient httpClient,
            ReachabilityChecker reachabilityChecker,
            MetricsRegistry metrics,
            Duration probeTimeout,
            int reachabilityTimeoutMs
    ) {
        this.registry = registry;
        this.httpClient = httpClient;
        this.reachabilityChecker = reachabilityChecker;
        this.metrics = metrics;
        this.probeTimeout = probeTimeout;
        this.reachabilityTimeoutMs = reachabilityTimeoutMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Probes a single server and updates its health. Never throws.
     *
     * @return true if the server is healthy
     */
    public boolean probe(ServerRecord server) {
        log.debug("Health check started: server={}, active={}, errorCount={}",
                server.getName(), server.isActive(), server.getErrorCount());

        try {
            if (!reachabilityChecker.isReachable(server.getHost(), reachabilityTimeoutMs)) {
                int errors = server.recordProbeFailure();
                recordProbe(server, FailureKind.UNREACHABLE);
                log.warn("Server {} is not reachable: host={}, errorCount={}",
                        server.getName(), server.getHost(), errors);
                return false;
            }

            long start = System.nanoTime();
            boolean healthy = httpClient.healthCheck(server, probeTimeout)
                    .completeOnTimeout(false, probeTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)
                    .join();
            Duration latency = Duration.ofNanos(System.nanoTime() - start);

            if (healthy) {
                boolean wasInactive = server.recordProbeSuccess(latency, registry.getClock().instant());
                recordProbe(server, null);
                if (wasInactive) {
                    log.info("Server back online: server={}, responseTimeMs={}", server.getName(), latency.toMillis());
                } else {
                    log.info("Server healthy: server={}, responseTimeMs={}", server.getName(), latency.toMillis());
                }
                return true;
            }

            int errors = server.recordProbeFailure();
            recordProbe(server, FailureKind.PROTOCOL_FAILURE);
            log.warn("Health check returned unhealthy: server={}, errorCount={}", server.getName(), errors);
            return false;
        } catch (RuntimeException e) {
            int errors = server.recordProbeFailure();
            recordProbe(server, FailureKind.INTERNAL_ERROR);
            log.warn("Health check failed: server={}, errorCount={}, error={}",
                    server.getName(), errors, e.getMessage());
            return false;
        }
    }

    /**
     * Probes every server and stamps the sweep time.
     *
     * @return the cluster status after the sweep
     */
    public ClusterStatus probeAll() {
        log.info("Starting health check of all servers: count={}", registry.size());
        for (ServerRecord server : registry.getAllServers()) {
            probe(server);
        }
        registry.markSweep();

        ClusterStatus status = registry.snapshot();
        log.info("Health check complete: active={}/{}", status.activeServers(), status.totalServers());
        return status;
    }

    /**
     * Probes only the inactive servers.
     *
     * @return the number of servers reactivated
     */
    public int probeInactive() {
        List<ServerRecord> inactive = registry.getInactiveServers();
        if (inactive.isEmpty()) {
            return 0;
        }

        log.info("Checking inactive servers for reconnection: count={}", inactive.size());
        int reactivated = 0;
        for (ServerRecord server : inactive) {
            if (probe(server)) {
                reactivated++;
            }
        }

        if (reactivated > 0) {
            log.info("Reactivated servers: count={}", reactivated);
        } else {
            log.debug("No servers reactivated");
        }
        return reactivated;
    }

    /**
     * Immediately probes the inactive servers, regardless of the sweep schedule.
     *
     * @return the cluster status after the sweep
     */
    public ClusterStatus forceReconnect() {
        log.info("Forcing reconnection check of inactive servers");
        probeInactive();
        registry.markSweep();
        return registry.snapshot();
    }

    /**
     * Starts the periodic background sweep of inactive servers.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            long intervalMs = registry.getSweepInterval().toMillis();
            scheduler.scheduleWithFixedDelay(
                    this::backgroundSweep,
                    intervalMs,
                    intervalMs,
                    TimeUnit.MILLISECONDS
            );
            log.info("Background health checker started with interval: {}", registry.getSweepInterval());
        }
    }

    private void backgroundSweep() {
        try {
            probeInactive();
            registry.markSweep();
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("Background health check failed", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void recordProbe(ServerRecord server, FailureKind kind) {
        if (metrics != null) {
            metrics.recordProbe(server.getName(), kind);
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}

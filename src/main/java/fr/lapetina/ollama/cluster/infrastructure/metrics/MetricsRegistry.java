package fr.lapetina.ollama.cluster.infrastructure.metrics;

import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Dispatch attempt counters per server and outcome
 * - Dispatch latency histograms per server
 * - Probe counters per server and outcome
 * - Chunk result counters per status
 * - Per-server health gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    static final String SUCCESS = "success";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> probeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> chunkCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("ollama_cluster");
    }

    /**
     * Records one dispatch attempt against a server.
     *
     * @param failureKind null for a successful attempt
     */
    public void recordAttempt(String server, FailureKind failureKind) {
        String outcome = failureKind == null ? SUCCESS : failureKind.name();
        attemptCounters.computeIfAbsent(server + ":" + outcome, k ->
                Counter.builder(prefix + "_dispatch_attempts_total")
                        .description("Total number of dispatch attempts")
                        .tag("server", server)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of a successful dispatch.
     */
    public void recordLatency(String server, Duration latency) {
        latencyTimers.computeIfAbsent(server, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("Dispatch latency")
                        .tag("server", server)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records one probe outcome.
     *
     * @param failureKind null for a successful probe
     */
    public void recordProbe(String server, FailureKind failureKind) {
        String outcome = failureKind == null ? SUCCESS : failureKind.name();
        probeCounters.computeIfAbsent(server + ":" + outcome, k ->
                Counter.builder(prefix + "_probes_total")
                        .description("Total number of health probes")
                        .tag("server", server)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records one completed chunk.
     */
    public void recordChunk(ChunkResult.Status status) {
        chunkCounters.computeIfAbsent(status.name(), k ->
                Counter.builder(prefix + "_chunks_total")
                        .description("Total number of processed chunks")
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers health gauges for a server.
     */
    public void registerServer(ServerRecord server) {
        Gauge.builder(prefix + "_server_active", server, s -> s.isActive() ? 1 : 0)
                .description("Server active flag (1=active, 0=inactive)")
                .tag("server", server.getName())
                .register(registry);
        Gauge.builder(prefix + "_server_errors", server, ServerRecord::getErrorCount)
                .description("Consecutive errors per server")
                .tag("server", server.getName())
                .register(registry);
    }

    /**
     * Registers the gauge for the number of active servers.
     */
    public void registerActiveServers(Supplier<Number> activeCount) {
        Gauge.builder(prefix + "_active_servers", activeCount, s -> s.get().doubleValue())
                .description("Number of active servers")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

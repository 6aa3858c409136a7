package fr.lapetina.ollama.cluster;

import fr.lapetina.ollama.cluster.dispatch.RetryingDispatcher;
import fr.lapetina.ollama.cluster.dispatch.ServerSelector;
import fr.lapetina.ollama.cluster.disruptor.FanOutScheduler;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.domain.strategy.RoundRobinStrategy;
import fr.lapetina.ollama.cluster.extraction.ChunkSource;
import fr.lapetina.ollama.cluster.extraction.ExtractionJobManager;
import fr.lapetina.ollama.cluster.extraction.ExtractionRequestFactory;
import fr.lapetina.ollama.cluster.extraction.ExtractionService;
import fr.lapetina.ollama.cluster.extraction.ObservationExtractor;
import fr.lapetina.ollama.cluster.extraction.ObservationParser;
import fr.lapetina.ollama.cluster.extraction.ObservationSink;
import fr.lapetina.ollama.cluster.extraction.ParagraphChunker;
import fr.lapetina.ollama.cluster.infrastructure.config.ClusterConfig;
import fr.lapetina.ollama.cluster.infrastructure.config.ConfigLoader;
import fr.lapetina.ollama.cluster.infrastructure.health.ClusterRegistry;
import fr.lapetina.ollama.cluster.infrastructure.health.HealthProber;
import fr.lapetina.ollama.cluster.infrastructure.health.InetReachabilityChecker;
import fr.lapetina.ollama.cluster.infrastructure.health.ReachabilityChecker;
import fr.lapetina.ollama.cluster.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Factory for creating a fully-wired cluster from configuration.
 * Every component is built once here and shared by reference.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClusterFactory cluster = ClusterFactory.create("cluster.yaml").start()) {
 *     BatchResult result = cluster.getExtractionService()
 *             .extractChunks(chunks, null, progress -> log.info(progress.message()));
 * }
 * }</pre>
 */
public class ClusterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterFactory.class);

    private final ClusterConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ClusterRegistry registry;
    private final OllamaHttpClient httpClient;
    private final HealthProber prober;
    private final ServerSelector selector;
    private final RetryingDispatcher dispatcher;
    private final FanOutScheduler scheduler;
    private final ObservationExtractor extractor;
    private final ExtractionService extractionService;
    private final ExtractionJobManager jobManager;

    protected ClusterFactory(
            ClusterConfig config,
            OllamaHttpClient httpClientOverride,
            ReachabilityChecker reachabilityOverride,
            Clock clock
    ) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Initialize server registry
        this.registry = new ClusterRegistry(
                loadServers(),
                Duration.ofMillis(config.getHealthCheck().getSweepIntervalMs()),
                clock
        );

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        ReachabilityChecker reachabilityChecker = reachabilityOverride != null
                ? reachabilityOverride
                : createReachabilityChecker();

        this.prober = new HealthProber(
                registry,
                httpClient,
                reachabilityChecker,
                metricsRegistry,
                Duration.ofMillis(config.getHealthCheck().getProbeTimeoutMs()),
                config.getHealthCheck().getReachabilityTimeoutMs()
        );

        RoundRobinStrategy strategy = new RoundRobinStrategy();
        this.selector = new ServerSelector(registry, prober, strategy);
        this.dispatcher = new RetryingDispatcher(selector, httpClient, metricsRegistry, config.getRetry().getMaxRetries());

        this.scheduler = new FanOutScheduler(registry, metricsRegistry, config.getExtraction().getCompletionBufferSize());
        this.extractor = new ObservationExtractor(
                dispatcher,
                new ExtractionRequestFactory(config.getExtraction().getModel()),
                new ObservationParser(),
                config.getRetry().getMaxRetries()
        );
        this.extractionService = createExtractionService(new ParagraphChunker(), ObservationSink.NONE);
        this.jobManager = new ExtractionJobManager(
                extractionService,
                Duration.ofMillis(config.getExtraction().getJobRetentionMs()),
                clock
        );

        registerServerMetrics();

        log.info("ClusterFactory initialized: servers={}, strategy={}, maxRetries={}",
                registry.size(), strategy.getName(), config.getRetry().getMaxRetries());
    }

    /**
     * Creates a cluster from the specified configuration file.
     */
    public static ClusterFactory create(String configPath) {
        log.info("Initializing ClusterFactory from config: {}", configPath);
        return create(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a cluster from an already loaded configuration.
     */
    public static ClusterFactory create(ClusterConfig config) {
        return new ClusterFactory(config, null, null, Clock.systemUTC());
    }

    /**
     * Creates a cluster from the default configuration (cluster.yaml).
     */
    public static ClusterFactory create() {
        return create("cluster.yaml");
    }

    /**
     * Starts the completion channel and, if enabled, the background health checker.
     */
    public ClusterFactory start() {
        scheduler.start();
        if (config.getHealthCheck().isBackground()) {
            prober.start();
        }
        log.info("Cluster started");
        return this;
    }

    /**
     * Creates an extraction service sharing this cluster with other collaborators.
     */
    public ExtractionService createExtractionService(ChunkSource chunkSource, ObservationSink sink) {
        return new ExtractionService(
                scheduler,
                extractor,
                prober,
                chunkSource,
                sink,
                config.getExtraction().isProbeBeforeBatch()
        );
    }

    public ClusterConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ClusterRegistry getRegistry() {
        return registry;
    }

    public OllamaHttpClient getHttpClient() {
        return httpClient;
    }

    public HealthProber getProber() {
        return prober;
    }

    public ServerSelector getSelector() {
        return selector;
    }

    public RetryingDispatcher getDispatcher() {
        return dispatcher;
    }

    public FanOutScheduler getScheduler() {
        return scheduler;
    }

    public ExtractionService getExtractionService() {
        return extractionService;
    }

    public ExtractionJobManager getJobManager() {
        return jobManager;
    }

    private OllamaHttpClient createHttpClient() {
        return new OllamaHttpClient(Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()));
    }

    private ReachabilityChecker createReachabilityChecker() {
        if (config.getHealthCheck().isReachabilityCheck()) {
            return new InetReachabilityChecker();
        }
        log.info("Reachability check disabled, relying on HTTP probes only");
        return ReachabilityChecker.alwaysReachable();
    }

    private List<ServerRecord> loadServers() {
        return config.getServers().stream()
                .map(serverConfig -> {
                    ServerRecord server = ServerRecord.builder()
                            .name(serverConfig.getName())
                            .baseUrl(serverConfig.getUrl())
                            .model(serverConfig.getModel())
                            .timeout(Duration.ofMillis(serverConfig.getTimeoutMs()))
                            .maxRetries(serverConfig.getMaxRetries())
                            .maxErrors(serverConfig.getMaxErrors())
                            .build();
                    log.debug("Registered server: {}", server);
                    return server;
                })
                .toList();
    }

    private void registerServerMetrics() {
        if (metricsRegistry == null) {
            return;
        }
        for (ServerRecord server : registry.getAllServers()) {
            metricsRegistry.registerServer(server);
        }
        metricsRegistry.registerActiveServers(registry::activeCount);
    }

    @Override
    public void close() {
        log.info("Shutting down ClusterFactory...");

        try {
            prober.close();
        } catch (Exception e) {
            log.warn("Error closing health prober", e);
        }

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing scheduler", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("ClusterFactory shut down");
    }
}

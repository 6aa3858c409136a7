package fr.lapetina.ollama.cluster;

import fr.lapetina.ollama.cluster.api.HttpServer;
import fr.lapetina.ollama.cluster.infrastructure.config.ClusterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Ollama extraction cluster.
 */
public class OllamaClusterApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaClusterApplication.class);

    private final ClusterFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public OllamaClusterApplication(String configPath) throws Exception {
        this(ClusterFactory.create(configPath));
    }

    public OllamaClusterApplication(ClusterFactory factory) throws Exception {
        log.info("Starting Ollama cluster...");

        this.factory = factory.start();

        ClusterConfig.ApiConfig api = factory.getConfig().getApi();
        this.httpServer = new HttpServer(
                api.getHost(),
                api.getPort(),
                api.getBacklog(),
                api.getThreads(),
                factory.getExtractionService(),
                factory.getJobManager(),
                factory.getRegistry(),
                factory.getProber(),
                factory.getMetricsRegistry()
        );

        log.info("Ollama cluster initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Ollama cluster started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ClusterFactory getFactory() {
        return factory;
    }

    public HttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down Ollama cluster...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Ollama cluster shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "cluster.yaml";

        try {
            OllamaClusterApplication app = new OllamaClusterApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Ollama cluster", e);
            System.exit(1);
        }
    }
}

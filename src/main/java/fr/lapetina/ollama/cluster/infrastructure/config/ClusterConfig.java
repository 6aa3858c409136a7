package fr.lapetina.ollama.cluster.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the cluster.
 * Designed to be populated from YAML.
 */
public class ClusterConfig {

    private ApiConfig api = new ApiConfig();
    private List<ServerConfig> servers = new ArrayList<>();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public List<ServerConfig> getServers() { return servers; }
    public void setServers(List<ServerConfig> servers) { this.servers = servers; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public ExtractionConfig getExtraction() { return extraction; }
    public void setExtraction(ExtractionConfig extraction) { this.extraction = extraction; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP API configuration.
     */
    public static class ApiConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 8;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Individual Ollama server configuration.
     */
    public static class ServerConfig {
        private String name;
        private String url;
        private String model = "gemma3";
        private long timeoutMs = 30000;
        private int maxRetries = 3;
        private int maxErrors = 5;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public int getMaxErrors() { return maxErrors; }
        public void setMaxErrors(int maxErrors) { this.maxErrors = maxErrors; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private long sweepIntervalMs = 30000;
        private long probeTimeoutMs = 5000;
        private int reachabilityTimeoutMs = 1000;
        private boolean reachabilityCheck = true;
        private boolean background = false;

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public int getReachabilityTimeoutMs() { return reachabilityTimeoutMs; }
        public void setReachabilityTimeoutMs(int reachabilityTimeoutMs) { this.reachabilityTimeoutMs = reachabilityTimeoutMs; }

        public boolean isReachabilityCheck() { return reachabilityCheck; }
        public void setReachabilityCheck(boolean reachabilityCheck) { this.reachabilityCheck = reachabilityCheck; }

        public boolean isBackground() { return background; }
        public void setBackground(boolean background) { this.background = background; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * Observation extraction configuration.
     */
    public static class ExtractionConfig {
        // null means each server uses its own model
        private String model;
        private boolean probeBeforeBatch = true;
        private int completionBufferSize = 1024;
        // finished jobs stay queryable this long
        private long jobRetentionMs = 600000;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public boolean isProbeBeforeBatch() { return probeBeforeBatch; }
        public void setProbeBeforeBatch(boolean probeBeforeBatch) { this.probeBeforeBatch = probeBeforeBatch; }

        public int getCompletionBufferSize() { return completionBufferSize; }
        public void setCompletionBufferSize(int completionBufferSize) { this.completionBufferSize = completionBufferSize; }

        public long getJobRetentionMs() { return jobRetentionMs; }
        public void setJobRetentionMs(long jobRetentionMs) { this.jobRetentionMs = jobRetentionMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ollama_cluster";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

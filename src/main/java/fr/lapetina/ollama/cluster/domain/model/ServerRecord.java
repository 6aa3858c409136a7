package fr.lapetina.ollama.cluster.domain.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents one Ollama server of the cluster together with its live health state.
 *
 * Identity and configuration are immutable. Health fields are guarded by the
 * record's own lock so that concurrent workers failing against the same server
 * never lose an error count update or miss the deactivation threshold.
 */
public final class ServerRecord {
    private final String name;
    private final URI baseUrl;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;
    private final int maxErrors;

    // Guarded by lock
    private final Object lock = new Object();
    private boolean active;
    private int errorCount;
    private Instant lastCheck;
    private Duration responseTime;

    private ServerRecord(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Server name is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        this.model = Objects.requireNonNull(builder.model, "Model is required");
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout is required");
        if (builder.maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be at least 1: " + builder.maxErrors);
        }
        this.maxRetries = builder.maxRetries;
        this.maxErrors = builder.maxErrors;
        this.active = builder.active;
    }

    public String getName() {
        return name;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Host part of the base URL, used for the reachability check.
     */
    public String getHost() {
        return baseUrl.getHost();
    }

    public String getModel() {
        return model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Configured per-server retry budget. Reported in status snapshots only:
     * the dispatcher uses the cluster-wide budget for every request.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public boolean isActive() {
        synchronized (lock) {
            return active;
        }
    }

    public int getErrorCount() {
        synchronized (lock) {
            return errorCount;
        }
    }

    public Instant getLastCheck() {
        synchronized (lock) {
            return lastCheck;
        }
    }

    public Duration getResponseTime() {
        synchronized (lock) {
            return responseTime;
        }
    }

    /**
     * Records a successful probe.
     *
     * @return true if the server was inactive before this probe
     */
    public boolean recordProbeSuccess(Duration latency, Instant checkedAt) {
        synchronized (lock) {
            boolean wasInactive = !active;
            active = true;
            errorCount = 0;
            responseTime = latency;
            lastCheck = checkedAt;
            return wasInactive;
        }
    }

    /**
     * Records a failed probe. A failed probe always deactivates the server.
     *
     * @return the error count after this failure
     */
    public int recordProbeFailure() {
        synchronized (lock) {
            active = false;
            return ++errorCount;
        }
    }

    /**
     * Records a successful work request. Treated like a successful probe.
     *
     * @return true if the server was inactive before this request
     */
    public boolean recordDispatchSuccess(Duration latency) {
        synchronized (lock) {
            boolean wasInactive = !active;
            active = true;
            errorCount = 0;
            responseTime = latency;
            return wasInactive;
        }
    }

    /**
     * Records a failed work request, deactivating the server when the error
     * count reaches {@code maxErrors}.
     *
     * @return the health state right after this failure
     */
    public FailureRecord recordDispatchFailure() {
        synchronized (lock) {
            int count = ++errorCount;
            boolean deactivated = false;
            if (active && count >= maxErrors) {
                active = false;
                deactivated = true;
            }
            return new FailureRecord(count, deactivated);
        }
    }

    /**
     * Outcome of {@link #recordDispatchFailure()}.
     *
     * @param errorCount  error count after the failure
     * @param deactivated true if this failure crossed the threshold
     */
    public record FailureRecord(int errorCount, boolean deactivated) {
    }

    /**
     * Returns a consistent copy of the server's current state.
     */
    public ServerStatus snapshot() {
        synchronized (lock) {
            return new ServerStatus(
                    name, baseUrl.toString(), model, maxRetries, active,
                    errorCount, maxErrors, responseTime, lastCheck
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerRecord that = (ServerRecord) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "ServerRecord{" +
                    "name='" + name + '\'' +
                    ", baseUrl=" + baseUrl +
                    ", model='" + model + '\'' +
                    ", active=" + active +
                    ", errors=" + errorCount +
                    "/" + maxErrors +
                    '}';
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private URI baseUrl;
        private String model = "gemma3";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private int maxErrors = 5;
        private boolean active = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
            return this;
        }

        public Builder baseUrl(URI url) {
            return baseUrl(url.toString());
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public ServerRecord build() {
            return new ServerRecord(this);
        }
    }
}

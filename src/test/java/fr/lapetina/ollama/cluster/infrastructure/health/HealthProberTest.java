package fr.lapetina.ollama.cluster.infrastructure.health;

import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ollama.cluster.support.MutableClock;
import fr.lapetina.ollama.cluster.support.Servers;
import fr.lapetina.ollama.cluster.support.StubHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class HealthProberTest {

    private MutableClock clock;
    private StubHttpClient httpClient;
    private MetricsRegistry metrics;
    private Set<String> unreachableHosts;
    private ServerRecord alpha;
    private ServerRecord beta;
    private ServerRecord gamma;
    private ClusterRegistry registry;
    private HealthProber prober;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        httpClient = new StubHttpClient();
        metrics = new MetricsRegistry("test", false);
        unreachableHosts = ConcurrentHashMap.newKeySet();

        alpha = Servers.server("alpha");
        beta = Servers.inactive("beta");
        gamma = Servers.inactive("gamma");
        registry = new ClusterRegistry(List.of(alpha, beta, gamma), Duration.ofSeconds(30), clock);

        prober = new HealthProber(
                registry,
                httpClient,
                (host, timeoutMs) -> !unreachableHosts.contains(host),
                metrics,
                Duration.ofSeconds(1),
                100
        );
    }

    @AfterEach
    void tearDown() {
        prober.close();
        metrics.close();
    }

    @Nested
    @DisplayName("Single probe")
    class SingleProbeTests {

        @Test
        @DisplayName("should skip the HTTP check when the host is unreachable")
        void shouldSkipHttpWhenUnreachable() {
            unreachableHosts.add(alpha.getHost());

            boolean healthy = prober.probe(alpha);

            assertThat(healthy).isFalse();
            assertThat(alpha.isActive()).isFalse();
            assertThat(alpha.getErrorCount()).isEqualTo(1);
            assertThat(httpClient.getHealthCalls()).isEmpty();
            assertThat(metrics.getRegistry().find("test_probes_total")
                    .tag("server", "alpha").tag("outcome", "UNREACHABLE")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should mark server healthy on status 200")
        void shouldMarkHealthyOn200() {
            alpha.recordDispatchFailure();

            boolean healthy = prober.probe(alpha);

            assertThat(healthy).isTrue();
            assertThat(alpha.isActive()).isTrue();
            assertThat(alpha.getErrorCount()).isZero();
            assertThat(alpha.getLastCheck()).isEqualTo(clock.instant());
            assertThat(alpha.getResponseTime()).isNotNull();
        }

        @Test
        @DisplayName("should reactivate an inactive server")
        void shouldReactivateInactiveServer() {
            beta.recordProbeFailure();

            assertThat(prober.probe(beta)).isTrue();
            assertThat(beta.isActive()).isTrue();
            assertThat(beta.getErrorCount()).isZero();
        }

        @Test
        @DisplayName("should deactivate an active server on a failed HTTP check")
        void shouldDeactivateOnFailedHttpCheck() {
            httpClient.setHealthy("alpha", false);

            assertThat(prober.probe(alpha)).isFalse();
            assertThat(alpha.isActive()).isFalse();
            assertThat(alpha.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should never throw when the HTTP client fails")
        void shouldNeverThrow() {
            StubHttpClient failing = new StubHttpClient() {
                @Override
                public CompletableFuture<Boolean> healthCheck(ServerRecord server, Duration timeout) {
                    return CompletableFuture.failedFuture(new IllegalStateException("boom"));
                }
            };
            HealthProber failingProber = new HealthProber(registry, failing,
                    ReachabilityChecker.alwaysReachable(), null, Duration.ofSeconds(1), 100);

            assertThat(failingProber.probe(alpha)).isFalse();
            assertThat(alpha.isActive()).isFalse();
            failingProber.close();
        }
    }

    @Nested
    @DisplayName("Sweeps")
    class SweepTests {

        @Test
        @DisplayName("should probe only inactive servers and count reactivations")
        void shouldProbeOnlyInactiveServers() {
            httpClient.setHealthy("gamma", false);

            int reactivated = prober.probeInactive();

            assertThat(reactivated).isEqualTo(1);
            assertThat(httpClient.getHealthCalls()).containsExactly("beta", "gamma");
            assertThat(beta.isActive()).isTrue();
            assertThat(gamma.isActive()).isFalse();
        }

        @Test
        @DisplayName("should not probe anything when all servers are active")
        void shouldNotProbeWhenAllActive() {
            prober.probeAll();
            httpClient.clearCalls();

            assertThat(prober.probeInactive()).isZero();
            assertThat(httpClient.getHealthCalls()).isEmpty();
        }

        @Test
        @DisplayName("should probe every server and stamp the sweep time")
        void shouldProbeAllAndStampSweep() {
            httpClient.setHealthy("alpha", false);

            ClusterStatus status = prober.probeAll();

            assertThat(httpClient.getHealthCalls()).containsExactly("alpha", "beta", "gamma");
            assertThat(status.activeServers()).isEqualTo(2);
            assertThat(registry.getLastSweep()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should force reconnection of inactive servers")
        void shouldForceReconnect() {
            ClusterStatus status = prober.forceReconnect();

            assertThat(status.activeServers()).isEqualTo(3);
            assertThat(httpClient.getHealthCalls()).containsExactly("beta", "gamma");
        }
    }

    @Test
    @DisplayName("should start and stop the background sweep")
    void shouldStartAndStopBackgroundSweep() {
        prober.start();
        assertThat(prober.isRunning()).isTrue();

        prober.close();
        assertThat(prober.isRunning()).isFalse();
    }
}

package fr.lapetina.ollama.cluster.infrastructure.health;

import fr.lapetina.ollama.cluster.domain.model.ClusterStatus;
import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.support.MutableClock;
import fr.lapetina.ollama.cluster.support.Servers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterRegistryTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private MutableClock clock;
    private ClusterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ClusterRegistry(
                List.of(Servers.server("A"), Servers.inactive("B"), Servers.server("C")),
                INTERVAL,
                clock
        );
    }

    @Test
    @DisplayName("should keep configuration order when filtering")
    void shouldKeepOrder() {
        assertThat(registry.getAllServers()).extracting(ServerRecord::getName).containsExactly("A", "B", "C");
        assertThat(registry.getActiveServers()).extracting(ServerRecord::getName).containsExactly("A", "C");
        assertThat(registry.getInactiveServers()).extracting(ServerRecord::getName).containsExactly("B");
        assertThat(registry.activeCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should find servers by name")
    void shouldFindServersByName() {
        assertThat(registry.getServer("C")).isPresent();
        assertThat(registry.getServer("Z")).isEmpty();
    }

    @Test
    @DisplayName("should reject duplicate server names")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> new ClusterRegistry(Servers.servers("A", "A"), INTERVAL, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("A");
    }

    @Nested
    @DisplayName("Sweep schedule")
    class SweepScheduleTests {

        @Test
        @DisplayName("should claim the first sweep")
        void shouldClaimFirstSweep() {
            assertThat(registry.getLastSweep()).isNull();
            assertThat(registry.tryClaimSweep()).isTrue();
            assertThat(registry.getLastSweep()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should not claim again before more than the interval elapsed")
        void shouldNotClaimBeforeInterval() {
            registry.markSweep();

            clock.advance(INTERVAL);
            assertThat(registry.tryClaimSweep()).isFalse();

            clock.advance(Duration.ofMillis(1));
            assertThat(registry.tryClaimSweep()).isTrue();
            assertThat(registry.tryClaimSweep()).isFalse();
        }

        @Test
        @DisplayName("should grant a due sweep to exactly one concurrent caller")
        void shouldGrantSweepToOneCaller() throws InterruptedException {
            registry.markSweep();
            clock.advance(INTERVAL.plusSeconds(1));

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger winners = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (registry.tryClaimSweep()) {
                            winners.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(winners.get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should snapshot cluster status")
    void shouldSnapshotStatus() {
        registry.markSweep();

        ClusterStatus status = registry.snapshot();

        assertThat(status.totalServers()).isEqualTo(3);
        assertThat(status.activeServers()).isEqualTo(2);
        assertThat(status.isOutage()).isFalse();
        assertThat(status.healthCheckInterval()).isEqualTo(INTERVAL);
        assertThat(status.lastHealthCheck()).isEqualTo(clock.instant());
        assertThat(status.servers()).extracting("name").containsExactly("A", "B", "C");
    }
}

package fr.lapetina.ollama.cluster.dispatch;

import fr.lapetina.ollama.cluster.domain.model.ServerRecord;
import fr.lapetina.ollama.cluster.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.ollama.cluster.infrastructure.health.ClusterRegistry;
import fr.lapetina.ollama.cluster.infrastructure.health.HealthProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Picks the next server to send work to.
 *
 * Before selecting, reprobes the inactive servers if the sweep interval has
 * elapsed. Only the caller that claims the sweep runs it; the others select
 * from the current active set.
 */
public final class ServerSelector {

    private static final Logger log = LoggerFactory.getLogger(ServerSelector.class);

    private final ClusterRegistry registry;
    private final HealthProber prober;
    private final LoadBalancingStrategy strategy;

    public ServerSelector(ClusterRegistry registry, HealthProber prober, LoadBalancingStrategy strategy) {
        this.registry = registry;
        this.prober = prober;
        this.strategy = strategy;
    }

    /**
     * @return the next active server, or empty during an outage
     */
    public Optional<ServerRecord> nextAvailable() {
        if (registry.tryClaimSweep()) {
            log.debug("Sweep interval elapsed, checking inactive servers");
            prober.probeInactive();
        }

        List<ServerRecord> active = registry.getActiveServers();
        if (active.isEmpty()) {
            log.error("No active servers available: totalServers={}", registry.size());
            return Optional.empty();
        }

        Optional<ServerRecord> selected = strategy.selectServer(active);
        selected.ifPresent(server -> log.debug("Server selected: server={}, strategy={}, activeServers={}",
                server.getName(), strategy.getName(), active.size()));
        return selected;
    }

    public ClusterRegistry getRegistry() {
        return registry;
    }
}

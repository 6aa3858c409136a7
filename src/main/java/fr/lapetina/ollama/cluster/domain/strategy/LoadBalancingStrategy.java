package fr.lapetina.ollama.cluster.domain.strategy;

import fr.lapetina.ollama.cluster.domain.model.ServerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for picking the next server of the cluster.
 *
 * Implementations must be thread-safe as they are called from
 * every fan-out worker concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for logging.
     */
    String getName();

    /**
     * Selects a server among the currently active ones.
     *
     * @param activeServers Active servers, in configuration order
     * @return Selected server, or empty if the list is empty
     */
    Optional<ServerRecord> selectServer(List<ServerRecord> activeServers);

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}

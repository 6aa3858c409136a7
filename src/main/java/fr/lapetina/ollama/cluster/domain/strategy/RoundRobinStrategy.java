package fr.lapetina.ollama.cluster.domain.strategy;

import fr.lapetina.ollama.cluster.domain.model.ServerRecord;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the active servers.
 *
 * The cursor is a single shared counter taken modulo the current number of
 * active servers, so the set may shrink or grow between calls without any
 * reset. With a stable active set of n servers, any n consecutive selections
 * hit every server exactly once.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<ServerRecord> selectServer(List<ServerRecord> activeServers) {
        if (activeServers == null || activeServers.isEmpty()) {
            return Optional.empty();
        }

        // floorMod keeps the index valid after the counter overflows
        int index = Math.floorMod(counter.getAndIncrement(), activeServers.size());
        return Optional.of(activeServers.get(index));
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}

package fr.lapetina.ollama.cluster.infrastructure.health;

/**
 * Network-level reachability check run before the HTTP probe.
 */
@FunctionalInterface
public interface ReachabilityChecker {

    /**
     * @return true if the host answered within the timeout
     */
    boolean isReachable(String host, int timeoutMs);

    /**
     * Checker that considers every host reachable, leaving detection to the HTTP probe.
     */
    static ReachabilityChecker alwaysReachable() {
        return (host, timeoutMs) -> true;
    }
}

package fr.lapetina.ollama.cluster.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Reachability check based on {@link InetAddress#isReachable(int)}: ICMP echo
 * when permitted, TCP echo otherwise.
 * <p>
 * The TCP fallback connects to port 7. Hosts that drop that port silently
 * always look unreachable; disable the check with
 * {@code healthCheck.reachabilityCheck: false} for them.
 */
public final class InetReachabilityChecker implements ReachabilityChecker {

    private static final Logger log = LoggerFactory.getLogger(InetReachabilityChecker.class);

    @Override
    public boolean isReachable(String host, int timeoutMs) {
        if (host == null || host.isBlank()) {
            return false;
        }
        try {
            return InetAddress.getByName(host).isReachable(timeoutMs);
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve host: host={}", host);
            return false;
        } catch (IOException e) {
            log.warn("Reachability check failed: host={}, error={}", host, e.getMessage());
            return false;
        }
    }
}

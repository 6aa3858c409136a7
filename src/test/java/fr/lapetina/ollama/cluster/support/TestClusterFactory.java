package fr.lapetina.ollama.cluster.support;

import fr.lapetina.ollama.cluster.ClusterFactory;
import fr.lapetina.ollama.cluster.infrastructure.config.ClusterConfig;
import fr.lapetina.ollama.cluster.infrastructure.config.ConfigLoader;
import fr.lapetina.ollama.cluster.infrastructure.health.ReachabilityChecker;

import java.time.Clock;

/**
 * Cluster wired with a stub HTTP client and no network reachability checks.
 */
public class TestClusterFactory extends ClusterFactory {

    private final StubHttpClient stubClient;

    private TestClusterFactory(ClusterConfig config, StubHttpClient stubClient, Clock clock) {
        super(config, stubClient, ReachabilityChecker.alwaysReachable(), clock);
        this.stubClient = stubClient;
    }

    public static TestClusterFactory create(ClusterConfig config, StubHttpClient stubClient, Clock clock) {
        return new TestClusterFactory(config, stubClient, clock);
    }

    public static TestClusterFactory create(StubHttpClient stubClient) {
        return create(new ConfigLoader("test-config.yaml").load(), stubClient, new MutableClock());
    }

    public StubHttpClient getStubClient() {
        return stubClient;
    }
}

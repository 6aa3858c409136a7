/**
 * Server selection for the cluster.
 *
 * <p>Only {@link fr.lapetina.ollama.cluster.domain.strategy.RoundRobinStrategy} ships. It is
 * called with the active servers only, so health filtering stays in the registry.
 *
 * <pre>{@code
 * LoadBalancingStrategy strategy = new RoundRobinStrategy();
 * Optional<ServerRecord> server = strategy.selectServer(registry.getActiveServers());
 * }</pre>
 */
package fr.lapetina.ollama.cluster.domain.strategy;

/**
 * Server registry and health probing.
 *
 * <p>{@link fr.lapetina.ollama.cluster.infrastructure.health.ClusterRegistry} holds the
 * ordered servers and the sweep schedule; {@link fr.lapetina.ollama.cluster.infrastructure.health.HealthProber}
 * moves servers between active and inactive.
 */
package fr.lapetina.ollama.cluster.infrastructure.health;

/**
 * Configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.cluster.infrastructure.config.ClusterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.ollama.cluster.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code api} - HTTP server settings (host, port, backlog, threads)</li>
 *   <li>{@code servers} - Ollama servers with model, timeout and error threshold</li>
 *   <li>{@code healthCheck} - Sweep interval, probe timeouts, background sweep</li>
 *   <li>{@code timeouts} - Connection timeout</li>
 *   <li>{@code retry} - Attempts per request</li>
 *   <li>{@code extraction} - Model override, pre-batch sweep, completion buffer size</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>Without a configuration file the cluster runs against a single local server
 * at {@code http://localhost:11434}.
 */
package fr.lapetina.ollama.cluster.infrastructure.config;

/**
 * Ollama cluster - observation extraction spread over a pool of Ollama servers.
 *
 * <p>Requests are dispatched round-robin over the active servers, failed servers
 * are taken out of rotation and probed back in, and batches of text chunks are
 * processed in parallel with one worker per server.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.cluster.ClusterFactory} - Builds every component from YAML configuration</li>
 *   <li>{@link fr.lapetina.ollama.cluster.OllamaClusterApplication} - Standalone HTTP server with
 *       extraction and admin endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ClusterFactory cluster = ClusterFactory.create("cluster.yaml").start()) {
 *     BatchResult result = cluster.getExtractionService()
 *             .extractText(document, null, ProgressListener.NONE);
 *     result.observations().forEach(System.out::println);
 * }
 * }</pre>
 *
 * @see fr.lapetina.ollama.cluster.ClusterFactory
 * @see fr.lapetina.ollama.cluster.disruptor.FanOutScheduler
 */
package fr.lapetina.ollama.cluster;

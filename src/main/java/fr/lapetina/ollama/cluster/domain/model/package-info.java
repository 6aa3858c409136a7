/**
 * Domain model classes for the cluster dispatcher.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.ServerRecord} - Thread-safe identity and health of one Ollama server</li>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.ChatRequest} - Immutable request to be dispatched</li>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.DispatchResult} - Immutable outcome of a dispatch, success or tagged failure</li>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.FailureKind} - Failure taxonomy</li>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.ChunkResult} - Index-tagged result of one chunk of a batch</li>
 *   <li>{@link fr.lapetina.ollama.cluster.domain.model.ClusterStatus} - Snapshot read by status consumers</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything here is an immutable record or enum, except {@code ServerRecord}
 * whose health fields are updated under a per-record lock.
 */
package fr.lapetina.ollama.cluster.domain.model;

/**
 * Parallel fan-out of chunk batches with a Disruptor completion channel.
 *
 * <h2>Flow</h2>
 * <pre>
 * submit(chunks)
 *   -> per-batch worker pool (min(servers, chunks) threads)
 *        -> ChunkProcessor.process(index, chunk)
 *        -> publish ChunkCompletionEvent
 *   -> ChunkAggregationHandler (single thread)
 *        -> results[index] = result, progress event, metrics
 *        -> completes the batch future on the last chunk
 * </pre>
 *
 * <p>Workers only publish; all counting happens on the aggregator thread.
 */
package fr.lapetina.ollama.cluster.disruptor;

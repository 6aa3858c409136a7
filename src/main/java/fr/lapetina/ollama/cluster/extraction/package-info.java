/**
 * Observation extraction on top of the cluster.
 *
 * <p>The request factory and parser hold the wire protocol with the model. The
 * collaborator interfaces ({@link fr.lapetina.ollama.cluster.extraction.ChunkSource},
 * {@link fr.lapetina.ollama.cluster.extraction.ObservationSink},
 * {@link fr.lapetina.ollama.cluster.extraction.ProgressListener}) are where
 * document conversion, graph loading and UI progress plug in.
 */
package fr.lapetina.ollama.cluster.extraction;

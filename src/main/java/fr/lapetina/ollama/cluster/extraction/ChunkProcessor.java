package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.ChunkResult;

/**
 * Turns one chunk into its result. Called concurrently from the fan-out workers.
 */
@FunctionalInterface
public interface ChunkProcessor {

    ChunkResult process(int chunkIndex, String chunk);
}

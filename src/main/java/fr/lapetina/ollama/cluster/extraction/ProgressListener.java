package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.BatchProgress;

/**
 * Receives one event per completed chunk. Called from the aggregator thread,
 * or from the closing thread for chunks cut short by a scheduler shutdown;
 * never concurrently.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(BatchProgress progress);
}

package fr.lapetina.ollama.cluster.extraction;

import java.util.List;

/**
 * Splits a document into ordered chunks. A chunk's position in the returned
 * list is its index in the batch.
 */
@FunctionalInterface
public interface ChunkSource {

    List<String> chunk(String text);
}

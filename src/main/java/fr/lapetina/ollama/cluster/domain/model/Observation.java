package fr.lapetina.ollama.cluster.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One observation extracted from a chunk, tagged with the chunk it came from.
 *
 * <p>{@code chunkStartPos}/{@code chunkEndPos} bracket the observation text inside
 * its chunk. When the model paraphrased and the text cannot be found, they span
 * the whole chunk and {@code positionApproximate} is set.
 */
public record Observation(
        String observation,
        String relationship,
        List<Entity> entities,
        @JsonProperty("chunk_index") int chunkIndex,
        @JsonProperty("chunk_start_pos") int chunkStartPos,
        @JsonProperty("chunk_end_pos") int chunkEndPos,
        @JsonProperty("position_approximate") boolean positionApproximate
) {
    public Observation {
        Objects.requireNonNull(observation, "Observation text is required");
        Objects.requireNonNull(relationship, "Relationship is required");
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    /**
     * An entity mentioned in an observation.
     *
     * @param label    actual name of the entity, e.g. "IBM"
     * @param category one of the {@link EntityCategory} labels
     */
    public record Entity(String label, String category) {
        public Entity {
            Objects.requireNonNull(label, "Entity label is required");
            Objects.requireNonNull(category, "Entity category is required");
        }
    }
}

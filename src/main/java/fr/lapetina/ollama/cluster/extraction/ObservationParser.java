package fr.lapetina.ollama.cluster.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ollama.cluster.dispatch.MalformedOutputException;
import fr.lapetina.ollama.cluster.domain.model.Observation;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the model's reply content into observations and tags each one with
 * its position inside the chunk.
 */
public final class ObservationParser {

    private final ObjectMapper objectMapper;

    public ObservationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObservationParser() {
        this(new ObjectMapper());
    }

    /**
     * @param content    reply content, a JSON array of observations
     * @param chunk      the chunk the observations were extracted from
     * @param chunkIndex index of that chunk in its batch
     * @throws MalformedOutputException if the content does not match the schema
     */
    public List<Observation> parse(String content, String chunk, int chunkIndex) throws MalformedOutputException {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException("Reply content is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedOutputException("Reply content is not a JSON array");
        }

        List<Observation> observations = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            observations.add(toObservation(root.get(i), i, chunk, chunkIndex));
        }
        return observations;
    }

    private Observation toObservation(JsonNode node, int position, String chunk, int chunkIndex)
            throws MalformedOutputException {
        if (!node.isObject()) {
            throw new MalformedOutputException("Item " + position + " is not an object");
        }
        String text = requireText(node, "observation", position);
        String relationship = requireText(node, "relationship", position);

        JsonNode entitiesNode = node.get("entities");
        if (entitiesNode == null || !entitiesNode.isArray()) {
            throw new MalformedOutputException("Item " + position + " has no entities array");
        }
        List<Observation.Entity> entities = new ArrayList<>(entitiesNode.size());
        for (JsonNode entity : entitiesNode) {
            if (!entity.isObject()) {
                throw new MalformedOutputException("Item " + position + " has an entity that is not an object");
            }
            entities.add(new Observation.Entity(
                    requireText(entity, "label", position),
                    requireText(entity, "category", position)
            ));
        }

        int start = chunk.indexOf(text);
        if (start >= 0) {
            return new Observation(text, relationship, entities, chunkIndex, start, start + text.length(), false);
        }
        return new Observation(text, relationship, entities, chunkIndex, 0, chunk.length(), true);
    }

    private static String requireText(JsonNode node, String field, int position) throws MalformedOutputException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedOutputException("Item " + position + " is missing string field '" + field + "'");
        }
        return value.asText();
    }
}

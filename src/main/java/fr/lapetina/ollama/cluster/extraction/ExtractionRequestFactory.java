package fr.lapetina.ollama.cluster.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.ollama.cluster.domain.model.ChatRequest;
import fr.lapetina.ollama.cluster.domain.model.EntityCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the chat request sent for one chunk.
 *
 * Sampling is pinned (temperature 0, top_k 1, fixed seed) so that the same
 * chunk yields the same observations across runs, and the reply is constrained
 * by a JSON schema through the {@code format} field.
 */
public final class ExtractionRequestFactory {

    static final String SYSTEM_PROMPT = "Extract observations from the text. An observation is a natural language "
            + "statement that contains one or more entities and describes relationships or facts about them. "
            + "For each observation, identify the most important entities mentioned in it and provide a single "
            + "word that best describes the key relationship or fact. Try to limit to 2 entities per observation, "
            + "but you may include more if multiple people's names are listed together or if the observation "
            + "requires more entities to be meaningful. Use these standardized categories: "
            + String.join(", ", EntityCategory.labels()) + ". "
            + "The label should be the actual name of the entity (e.g., 'Bruce Lee' for a person, "
            + "'IBM' for an organization, 'New York' for a location).";

    static final String USER_PROMPT_PREFIX = "Extract observations from this text:\n\n";

    private final String model;
    private final ObjectNode schema;
    private final Map<String, Object> parameters;

    /**
     * @param model model to request, or null to use each server's own model
     */
    public ExtractionRequestFactory(String model) {
        this.model = model;
        this.schema = buildSchema(new ObjectMapper());
        this.parameters = samplingParameters();
    }

    public ChatRequest create(String chunk) {
        return create(chunk, model);
    }

    /**
     * Creates the request for one chunk, overriding the configured model.
     */
    public ChatRequest create(String chunk, String modelOverride) {
        return new ChatRequest(
                null,
                modelOverride != null ? modelOverride : model,
                List.of(
                        ChatRequest.Message.system(SYSTEM_PROMPT),
                        ChatRequest.Message.user(USER_PROMPT_PREFIX + chunk)
                ),
                schema,
                parameters
        );
    }

    public ObjectNode getSchema() {
        return schema.deepCopy();
    }

    private static Map<String, Object> samplingParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("temperature", 0);
        params.put("top_p", 1.0);
        params.put("top_k", 1);
        params.put("repeat_penalty", 1.0);
        params.put("seed", 42);
        return params;
    }

    private static ObjectNode buildSchema(ObjectMapper mapper) {
        ObjectNode label = mapper.createObjectNode()
                .put("type", "string")
                .put("description", "The actual name of the entity (e.g., 'Bruce Lee', 'IBM', 'New York')");

        ObjectNode category = mapper.createObjectNode()
                .put("type", "string")
                .put("description", "One of: " + String.join(", ", EntityCategory.labels()));
        ArrayNode categories = category.putArray("enum");
        EntityCategory.labels().forEach(categories::add);

        ObjectNode entity = mapper.createObjectNode().put("type", "object");
        entity.putObject("properties")
                .<ObjectNode>set("label", label)
                .set("category", category);
        entity.putArray("required").add("label").add("category");

        ObjectNode entities = mapper.createObjectNode()
                .put("type", "array")
                .put("description", "List of entities mentioned in the observation");
        entities.set("items", entity);

        ObjectNode item = mapper.createObjectNode().put("type", "object");
        ObjectNode properties = item.putObject("properties");
        properties.putObject("observation")
                .put("type", "string")
                .put("description", "A natural language statement that describes relationships or facts about entities");
        properties.putObject("relationship")
                .put("type", "string")
                .put("description", "A single word that best describes the key relationship or fact "
                        + "(e.g., 'lives', 'born', 'helps', 'protects', 'loves')");
        properties.set("entities", entities);
        item.putArray("required").add("observation").add("relationship").add("entities");

        ObjectNode root = mapper.createObjectNode().put("type", "array");
        root.set("items", item);
        return root;
    }
}

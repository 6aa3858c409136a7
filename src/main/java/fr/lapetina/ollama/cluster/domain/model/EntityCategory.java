package fr.lapetina.ollama.cluster.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Standardized entity categories the extraction model must choose from.
 */
public enum EntityCategory {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    OBJECT("Object"),
    LOCATION("Location"),
    EVENT("Event"),
    DATE("Date"),
    CONCEPT("Concept"),
    TRAIT("Trait"),
    ROLE("Role"),
    ANIMAL("Animal"),
    TECHNOLOGY("Technology"),
    PRODUCT("Product");

    private final String label;

    EntityCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(EntityCategory::getLabel).toList();
    }
}

package fr.lapetina.ollama.cluster.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Extraction request: either pre-split {@code chunks} or a raw {@code text}
 * split into paragraphs by the server.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractRequest {

    private List<String> chunks;
    private String text;
    private String model;

    public List<String> getChunks() { return chunks; }
    public void setChunks(List<String> chunks) { this.chunks = chunks; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    /**
     * Returns an error message, or null if the request is usable.
     */
    public String validate() {
        boolean hasChunks = chunks != null;
        boolean hasText = text != null;
        if (hasChunks == hasText) {
            return "Exactly one of 'chunks' or 'text' is required";
        }
        if (hasChunks && chunks.stream().anyMatch(chunk -> chunk == null)) {
            return "'chunks' must not contain null entries";
        }
        return null;
    }
}

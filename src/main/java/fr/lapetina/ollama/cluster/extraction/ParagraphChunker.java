package fr.lapetina.ollama.cluster.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text on blank lines, keeping non-empty paragraphs in document order.
 */
public final class ParagraphChunker implements ChunkSource {

    private static final Pattern BLANK_LINE = Pattern.compile("\\R\\s*\\R");

    @Override
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        for (String paragraph : BLANK_LINE.split(text)) {
            String trimmed = paragraph.strip();
            if (!trimmed.isEmpty()) {
                chunks.add(trimmed);
            }
        }
        return chunks;
    }
}

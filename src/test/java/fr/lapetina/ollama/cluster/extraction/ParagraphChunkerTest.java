package fr.lapetina.ollama.cluster.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParagraphChunkerTest {

    private final ParagraphChunker chunker = new ParagraphChunker();

    @Test
    @DisplayName("should split on blank lines in document order")
    void shouldSplitOnBlankLines() {
        String text = "First paragraph\nstill first.\n\nSecond.\r\n   \r\nThird.";

        assertThat(chunker.chunk(text)).containsExactly("First paragraph\nstill first.", "Second.", "Third.");
    }

    @Test
    @DisplayName("should drop empty paragraphs")
    void shouldDropEmptyParagraphs() {
        assertThat(chunker.chunk("\n\n  A  \n\n\n\n\nB\n\n")).containsExactly("A", "B");
    }

    @Test
    @DisplayName("should return nothing for blank text")
    void shouldReturnNothingForBlank() {
        assertThat(chunker.chunk(null)).isEmpty();
        assertThat(chunker.chunk(" \n \n")).isEmpty();
    }
}

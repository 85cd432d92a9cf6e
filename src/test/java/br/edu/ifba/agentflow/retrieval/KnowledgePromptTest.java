package br.edu.ifba.agentflow.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgePromptTest {

    @Test
    @DisplayName("should render a header followed by one line per chunk")
    void shouldRenderChunks() {
        String rendered = KnowledgePrompt.render(List.of(
            RetrievalChunk.of("first", "d1", "a.pdf"),
            RetrievalChunk.of("second", "d2", "b.pdf")), 1000);

        assertEquals("Relevant information from knowledge base:\nfirst\nsecond", rendered);
    }

    @Test
    @DisplayName("should truncate with an ellipsis past the maximum length")
    void shouldTruncate() {
        String rendered = KnowledgePrompt.render(List.of(RetrievalChunk.of("x".repeat(100), null, null)), 50);

        assertEquals(53, rendered.length());
        assertTrue(rendered.endsWith("..."));
        assertTrue(rendered.startsWith(KnowledgePrompt.HEADER));
    }

    @Test
    @DisplayName("should say so when nothing has content")
    void shouldReportNothingFound() {
        assertEquals(KnowledgePrompt.NOTHING_FOUND, KnowledgePrompt.render(List.of(), 1000));
    }
}

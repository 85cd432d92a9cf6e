package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders retrieved chunks as the text block a prompt embeds.
 */
public final class KnowledgePrompt {

    static final String HEADER = "Relevant information from knowledge base:\n";
    static final String NOTHING_FOUND = "No relevant information found in knowledge base.";

    private KnowledgePrompt() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param chunks chunks in prompt order
     * @param maxLength maximum rendered length before the {@code ...} suffix
     */
    @NotNull
    public static String render(@NotNull List<RetrievalChunk> chunks, int maxLength) {
        List<String> contents = chunks.stream()
            .map(RetrievalChunk::content)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        if (contents.isEmpty()) {
            return NOTHING_FOUND;
        }

        String text = HEADER + String.join("\n", contents);
        if (text.length() > maxLength) {
            return text.substring(0, maxLength) + "...";
        }
        return text;
    }
}

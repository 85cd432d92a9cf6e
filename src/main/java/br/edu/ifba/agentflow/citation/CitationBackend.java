package br.edu.ifba.agentflow.citation;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Inserts citation markers into a generated answer.
 */
@FunctionalInterface
public interface CitationBackend {

    /**
     * @param answer raw answer text
     * @param chunkContents content of each candidate chunk
     * @param chunkVectors embedding of each chunk, empty lists where unknown
     * @param embeddingModel model the vectors were produced with
     * @param keywordWeight weight of lexical similarity
     * @param vectorWeight weight of vector similarity
     */
    @NotNull
    CitationResult insertCitations(
        @NotNull String answer,
        @NotNull List<String> chunkContents,
        @NotNull List<List<Double>> chunkVectors,
        @NotNull EmbeddingModelRef embeddingModel,
        double keywordWeight,
        double vectorWeight
    );
}

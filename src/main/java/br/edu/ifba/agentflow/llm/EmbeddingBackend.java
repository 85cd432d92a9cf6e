package br.edu.ifba.agentflow.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text-to-vector embedding used to compare answer sentences with retrieved chunks.
 */
@FunctionalInterface
public interface EmbeddingBackend {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param modelId embedding model, {@code null} for the configured default
     * @param texts texts to embed
     * @return CompletableFuture with one vector per input text, in input order
     */
    CompletableFuture<List<float[]>> embed(@Nullable String modelId, @NotNull List<String> texts);
}

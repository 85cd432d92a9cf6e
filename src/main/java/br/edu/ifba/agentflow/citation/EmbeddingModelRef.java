package br.edu.ifba.agentflow.citation;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Embedding model a citation backend may use to compare answer sentences with chunks.
 */
public record EmbeddingModelRef(@NotNull String tenantId, @Nullable String modelId) {
}

package br.edu.ifba.agentflow.llm;

import org.jetbrains.annotations.NotNull;

/**
 * Resolves the chat model a stage is configured with.
 */
@FunctionalInterface
public interface GenerationBackendFactory {

    /**
     * @param tenantId tenant owning the conversation
     * @param llmId model id from the stage parameters
     * @return backend for that model
     */
    @NotNull
    GenerationBackend forModel(@NotNull String tenantId, @NotNull String llmId);
}

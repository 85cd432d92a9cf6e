package br.edu.ifba.agentflow.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Chat model used by the generating stages.
 * Implementations talk to an LLM provider; stages only see this contract.
 */
public interface GenerationBackend {

    /**
     * Default context window when the provider does not report one.
     */
    int DEFAULT_MAX_LENGTH = 4096;

    /**
     * Generate a completion.
     *
     * @param systemPrompt system prompt, may be empty
     * @param messages chat turns, never empty and ending on a user turn
     * @param config generation settings (max_tokens, temperature, top_p, ...)
     * @return CompletableFuture with the answer text
     */
    CompletableFuture<String> chat(
        @Nullable String systemPrompt,
        @NotNull List<ChatMessage> messages,
        @NotNull Map<String, Object> config
    );

    /**
     * Generate a completion incrementally. Each element is the answer produced so far,
     * so the last element is the complete answer.
     *
     * <p>The default implementation emits the synchronous answer as a single element.</p>
     */
    default Iterator<String> chatStreaming(
        @Nullable String systemPrompt,
        @NotNull List<ChatMessage> messages,
        @NotNull Map<String, Object> config
    ) {
        return List.of(chat(systemPrompt, messages, config).join()).iterator();
    }

    /**
     * @return context window size, measured in {@link #lengthUnit()}
     */
    default int maxLength() {
        return DEFAULT_MAX_LENGTH;
    }

    default LengthUnit lengthUnit() {
        return LengthUnit.TOKENS;
    }
}

package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * System prompt and chat turns ready for the backend. {@code messages} is never empty.
 */
public record FittedPrompt(@NotNull String systemPrompt, @NotNull List<ChatMessage> messages) {

    public FittedPrompt {
        systemPrompt = systemPrompt != null ? systemPrompt : "";
        messages = List.copyOf(messages);
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
    }
}

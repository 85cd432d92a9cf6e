package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.llm.ChatMessage;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Chat turn in the object shape the completion API expects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatMessage(
    String role,
    String content
) {
    public static LlmChatMessage from(ChatMessage message) {
        return new LlmChatMessage(message.role().wireName(), message.content());
    }
}

package br.edu.ifba.agentflow.engine;

import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * What a generating stage sent to its backend on the last run.
 */
public record ComponentInfo(
    @NotNull String prompt,
    @NotNull List<ChatMessage> messages,
    @NotNull Map<String, Object> config
) {
    public ComponentInfo {
        prompt = prompt != null ? prompt : "";
        messages = messages != null ? List.copyOf(messages) : List.of();
        config = config != null ? Map.copyOf(config) : Map.of();
    }
}

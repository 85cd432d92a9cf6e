package br.edu.ifba.agentflow.adapters;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<LlmChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    @JsonProperty("top_p")
    Double topP,

    @JsonProperty("presence_penalty")
    Double presencePenalty,

    @JsonProperty("frequency_penalty")
    Double frequencyPenalty
) {
    public LlmChatRequest(final String model, final List<LlmChatMessage> messages) {
        this(model, messages, false, null, null, null, null, null);
    }
}

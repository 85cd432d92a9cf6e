package br.edu.ifba.agentflow.adapters;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmEmbeddingResponse(
    String model,
    List<Embedding> data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedding(
        List<Double> embedding,
        Integer index
    ) {}
}

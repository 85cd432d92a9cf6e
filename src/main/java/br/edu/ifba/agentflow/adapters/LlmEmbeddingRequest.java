package br.edu.ifba.agentflow.adapters;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmEmbeddingRequest(
    String model,
    List<String> input
) {}

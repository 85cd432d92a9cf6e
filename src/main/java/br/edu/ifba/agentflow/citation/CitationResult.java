package br.edu.ifba.agentflow.citation;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * @param answer answer text, possibly annotated with citation markers
 * @param usedIndices indices of the chunks the markers point to
 */
public record CitationResult(@NotNull String answer, @NotNull List<Integer> usedIndices) {

    public CitationResult {
        answer = answer != null ? answer : "";
        usedIndices = usedIndices != null ? List.copyOf(usedIndices) : List.of();
    }
}

package br.edu.ifba.agentflow.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Citation payload attached to an answer: the sanitized chunks and one aggregate per cited document.
 */
public record Reference(
    @NotNull List<Map<String, Object>> chunks,

    @JsonProperty("doc_aggs")
    @NotNull List<DocAggregate> docAggs
) {

    private static final Reference EMPTY = new Reference(List.of(), List.of());

    public Reference {
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
        docAggs = docAggs != null ? List.copyOf(docAggs) : List.of();
    }

    public static Reference empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return chunks.isEmpty() && docAggs.isEmpty();
    }
}

package br.edu.ifba.agentflow.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Per-document entry of a reference: one per distinct document id.
 */
public record DocAggregate(
    @JsonProperty("doc_id")
    @NotNull String docId,

    @JsonProperty("doc_name")
    @NotNull String docName
) {
    public DocAggregate {
        Objects.requireNonNull(docId, "docId must not be null");
        Objects.requireNonNull(docName, "docName must not be null");
    }
}

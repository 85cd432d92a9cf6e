package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.retrieval.Reference;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One row of a stage result.
 *
 * @param content the text the stage produced
 * @param reference citations attached to the content
 * @param chunks serialized chunk payload, set by retrieval stages
 * @param emptyResponse message to surface when a retrieval stage found nothing
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultRow(
    @NotNull String content,
    @Nullable Reference reference,
    @Nullable String chunks,
    @JsonProperty("empty_response")
    @Nullable String emptyResponse
) {

    public ResultRow {
        Objects.requireNonNull(content, "content must not be null");
    }

    public ResultRow(@NotNull String content, @Nullable Reference reference) {
        this(content, reference, null, null);
    }

    /**
     * @return a row with the given content and an empty reference
     */
    public static ResultRow of(@NotNull String content) {
        return new ResultRow(content, Reference.empty());
    }

    public boolean hasChunks() {
        return chunks != null && !chunks.isBlank();
    }
}

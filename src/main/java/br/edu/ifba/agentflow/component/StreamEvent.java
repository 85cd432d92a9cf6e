package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.retrieval.Reference;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Item pulled from a streaming stage.
 */
public sealed interface StreamEvent {

    @NotNull
    String content();

    /**
     * Answer produced so far. Not authoritative.
     */
    record Partial(@NotNull String content) implements StreamEvent {
        public Partial {
            Objects.requireNonNull(content, "content must not be null");
        }
    }

    /**
     * Complete answer with its citations. Always the last event of a stream.
     */
    record Final(@NotNull String content, @NotNull Reference reference) implements StreamEvent {
        public Final {
            Objects.requireNonNull(content, "content must not be null");
            reference = reference != null ? reference : Reference.empty();
        }

        public static Final of(@NotNull ResultRow row) {
            return new Final(row.content(), row.reference() != null ? row.reference() : Reference.empty());
        }

        public ResultRow toRow() {
            return new ResultRow(content, reference);
        }
    }
}

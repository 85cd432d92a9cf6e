package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One retrieved passage.
 *
 * <p>Chunks are open-ended field maps because sources attach their own metadata
 * (source URL, score, vectors). The well-known fields have typed accessors.</p>
 */
public final class RetrievalChunk {

    public static final String CONTENT = "content";
    public static final String DOC_ID = "doc_id";
    public static final String DOC_NAME = "docnm_kwd";
    public static final String CONTENT_WITH_WEIGHT = "content_with_weight";
    public static final String VECTOR = "vector";
    public static final String CONTENT_TOKENS = "content_ltks";

    private final Map<String, Object> fields;

    public RetrievalChunk(@NotNull Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = new LinkedHashMap<>(fields);
    }

    public static RetrievalChunk of(@NotNull String content, @Nullable String docId, @Nullable String docName) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CONTENT, content);
        if (docId != null) {
            fields.put(DOC_ID, docId);
        }
        if (docName != null) {
            fields.put(DOC_NAME, docName);
        }
        return new RetrievalChunk(fields);
    }

    /**
     * @return a copy of this chunk with one field set
     */
    public RetrievalChunk with(@NotNull String key, @Nullable Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new RetrievalChunk(copy);
    }

    @Nullable
    public String content() {
        Object value = fields.get(CONTENT);
        return value != null ? value.toString() : null;
    }

    @Nullable
    public String docId() {
        Object value = fields.get(DOC_ID);
        return value != null ? value.toString() : null;
    }

    @Nullable
    public String docName() {
        Object value = fields.get(DOC_NAME);
        return value != null ? value.toString() : null;
    }

    public boolean hasWeightedContent() {
        return Boolean.TRUE.equals(fields.get(CONTENT_WITH_WEIGHT));
    }

    /**
     * @return embedding of the chunk, or an empty list when the source did not attach one
     */
    @NotNull
    public List<Double> vector() {
        Object value = fields.get(VECTOR);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .filter(Number.class::isInstance)
            .map(n -> ((Number) n).doubleValue())
            .toList();
    }

    @NotNull
    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetrievalChunk other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "RetrievalChunk" + fields;
    }
}

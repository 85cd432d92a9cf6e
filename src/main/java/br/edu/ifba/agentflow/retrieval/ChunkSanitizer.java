package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes chunk field maps safe to serialize and to expose to callers.
 */
public final class ChunkSanitizer {

    private static final Set<String> INTERNAL_FIELDS = Set.of(RetrievalChunk.VECTOR, RetrievalChunk.CONTENT_TOKENS);

    private ChunkSanitizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Coerces every value that is not a JSON primitive, list or map to its text form.
     */
    @NotNull
    public static Map<String, Object> serializable(@NotNull Map<String, ?> fields) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            result.put(entry.getKey(), coerce(entry.getValue()));
        }
        return result;
    }

    /**
     * Like {@link #serializable(Map)} and additionally drops raw vectors and token lists.
     */
    @NotNull
    public static Map<String, Object> forReference(@NotNull Map<String, ?> fields) {
        Map<String, Object> result = serializable(fields);
        result.keySet().removeAll(INTERNAL_FIELDS);
        return result;
    }

    private static Object coerce(Object value) {
        if (value == null
            || value instanceof String
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof List<?>
            || value instanceof Map<?, ?>) {
            return value;
        }
        return String.valueOf(value);
    }
}

package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Chunks returned by a retrieval source plus one aggregate per distinct document,
 * in first-seen order.
 */
public record RetrievalResultSet(
    @NotNull List<RetrievalChunk> chunks,
    @NotNull List<DocAggregate> docAggs
) {

    public RetrievalResultSet {
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
        docAggs = docAggs != null ? dedupe(docAggs) : List.of();
    }

    public static RetrievalResultSet empty() {
        return new RetrievalResultSet(List.of(), List.of());
    }

    /**
     * Builds a result set whose aggregates are derived from the chunks' document ids.
     */
    public static RetrievalResultSet of(@NotNull List<RetrievalChunk> chunks) {
        List<DocAggregate> aggs = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievalChunk chunk = chunks.get(i);
            if (chunk.docId() == null) {
                continue;
            }
            String name = chunk.docName() != null ? chunk.docName() : "Unknown Document " + i;
            aggs.add(new DocAggregate(chunk.docId(), name));
        }
        return new RetrievalResultSet(chunks, aggs);
    }

    /**
     * Concatenates result sets in the given order.
     */
    public static RetrievalResultSet merge(@NotNull List<RetrievalResultSet> parts) {
        List<RetrievalChunk> chunks = new ArrayList<>();
        List<DocAggregate> aggs = new ArrayList<>();
        for (RetrievalResultSet part : parts) {
            chunks.addAll(part.chunks());
            aggs.addAll(part.docAggs());
        }
        return new RetrievalResultSet(chunks, aggs);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    private static List<DocAggregate> dedupe(List<DocAggregate> aggs) {
        Set<String> seen = new LinkedHashSet<>();
        List<DocAggregate> result = new ArrayList<>();
        for (DocAggregate agg : aggs) {
            if (seen.add(agg.docId())) {
                result.add(agg);
            }
        }
        return List.copyOf(result);
    }
}

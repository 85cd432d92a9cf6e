package br.edu.ifba.agentflow.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalResultSetTest {

    @Test
    @DisplayName("should derive one aggregate per document from the chunks")
    void shouldDeriveAggregates() {
        RetrievalResultSet result = RetrievalResultSet.of(List.of(
            RetrievalChunk.of("a", "d1", "one.pdf"),
            RetrievalChunk.of("b", "d1", "one.pdf"),
            RetrievalChunk.of("c", "d2", null),
            RetrievalChunk.of("d", null, null)));

        assertEquals(4, result.chunks().size());
        assertEquals(List.of(new DocAggregate("d1", "one.pdf"), new DocAggregate("d2", "Unknown Document 2")),
            result.docAggs());
    }

    @Test
    @DisplayName("should merge parts in the given order")
    void shouldMergeInOrder() {
        RetrievalResultSet graph = RetrievalResultSet.of(List.of(RetrievalChunk.of("kg", "kg", "KG")));
        RetrievalResultSet web = RetrievalResultSet.of(List.of(RetrievalChunk.of("web", "https://x", "X")));

        RetrievalResultSet merged = RetrievalResultSet.merge(List.of(graph, RetrievalResultSet.empty(), web));

        assertEquals(List.of("kg", "web"), merged.chunks().stream().map(RetrievalChunk::content).toList());
        assertFalse(merged.isEmpty());
        assertTrue(RetrievalResultSet.merge(List.of()).isEmpty());
    }

    @Test
    @DisplayName("should make chunk fields serializable and hide internals from references")
    void shouldSanitizeChunks() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Map<String, Object> fields = Map.of(
            "content", "text", "vector", List.of(0.1), "content_ltks", "tok", "created", now, "score", 0.5);

        Map<String, Object> serializable = ChunkSanitizer.serializable(fields);
        Map<String, Object> reference = ChunkSanitizer.forReference(fields);

        assertEquals("2024-01-01T00:00:00Z", serializable.get("created"));
        assertEquals(0.5, serializable.get("score"));
        assertTrue(serializable.containsKey("vector"));
        assertFalse(reference.containsKey("vector"));
        assertFalse(reference.containsKey("content_ltks"));
        assertEquals("text", reference.get("content"));
    }

    @Test
    @DisplayName("should summarize the query as a weighted graph chunk")
    void shouldSummarizeQuery() {
        RetrievalResultSet result = new QuerySummaryGraphSource().retrieve("capital of France", 8);

        assertEquals(1, result.chunks().size());
        RetrievalChunk chunk = result.chunks().get(0);
        assertEquals("Knowledge Graph result for 'capital of France'.", chunk.content());
        assertTrue(chunk.hasWeightedContent());
        assertEquals(QuerySummaryGraphSource.DOC_ID, chunk.docId());
    }
}

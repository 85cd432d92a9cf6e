package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Graph-augmented source that contributes one weighted chunk summarizing the query.
 */
public class QuerySummaryGraphSource implements RetrievalSource {

    static final String DOC_ID = "kg_summary_doc";
    static final String DOC_NAME = "Knowledge Graph Summary";

    @Override
    @NotNull
    public RetrievalResultSet retrieve(@NotNull String query, int maxResults) {
        RetrievalChunk chunk = RetrievalChunk.of(
                String.format("Knowledge Graph result for '%s'.", query), DOC_ID, DOC_NAME)
            .with(RetrievalChunk.CONTENT_WITH_WEIGHT, Boolean.TRUE);
        return new RetrievalResultSet(List.of(chunk), List.of());
    }
}

package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

/**
 * A knowledge source the retrieval stage fans in from.
 */
@FunctionalInterface
public interface RetrievalSource {

    /**
     * @param query user question
     * @param maxResults upper bound on returned chunks
     * @return chunks and document aggregates, possibly empty
     */
    @NotNull
    RetrievalResultSet retrieve(@NotNull String query, int maxResults);
}

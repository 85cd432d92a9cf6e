package br.edu.ifba.agentflow.retrieval;

import org.jetbrains.annotations.NotNull;

/**
 * Creates a web search source bound to the API key a retrieval stage is configured with.
 */
@FunctionalInterface
public interface WebSearchSourceFactory {

    @NotNull
    RetrievalSource forApiKey(@NotNull String apiKey);
}

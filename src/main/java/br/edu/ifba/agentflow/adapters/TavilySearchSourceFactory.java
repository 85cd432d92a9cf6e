package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.retrieval.RetrievalSource;
import br.edu.ifba.agentflow.retrieval.WebSearchSourceFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

/**
 * Binds the API key a retrieval stage is configured with to the Tavily gateway.
 */
@ApplicationScoped
public class TavilySearchSourceFactory implements WebSearchSourceFactory {

    @Inject
    TavilySearchGateway gateway;

    @Override
    @NotNull
    public RetrievalSource forApiKey(@NotNull String apiKey) {
        return (query, maxResults) -> gateway.search(apiKey, query, maxResults);
    }
}

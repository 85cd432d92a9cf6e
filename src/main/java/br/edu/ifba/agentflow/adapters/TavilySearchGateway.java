package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.adapters.TavilyClient.TavilyResult;
import br.edu.ifba.agentflow.adapters.TavilyClient.TavilySearchRequest;
import br.edu.ifba.agentflow.adapters.TavilyClient.TavilySearchResponse;
import br.edu.ifba.agentflow.retrieval.RetrievalChunk;
import br.edu.ifba.agentflow.retrieval.RetrievalResultSet;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Web search through Tavily with circuit breaker and timeout.
 *
 * <p>Each hit becomes one chunk: the snippet as content, the URL as document id and
 * source, the page title as document name. When the circuit is open or the call
 * times out, the search yields no results.</p>
 */
@ApplicationScoped
public class TavilySearchGateway {

    private static final Logger LOG = LoggerFactory.getLogger(TavilySearchGateway.class);

    static final String SOURCE = "source";

    private static final String MDC_PROVIDER = "search.provider";
    private static final String MDC_MAX_RESULTS = "search.maxResults";

    @Inject
    @RestClient
    TavilyClient client;

    /**
     * @param apiKey     Tavily API key
     * @param query      search query
     * @param maxResults maximum number of results
     * @return chunks and per-document aggregates
     */
    @NotNull
    @CircuitBreaker(
        requestVolumeThreshold = 4,
        failureRatio = 0.5,
        delay = 10000,
        successThreshold = 2
    )
    @Timeout(value = 5000)
    @Fallback(fallbackMethod = "fallbackSearch")
    public RetrievalResultSet search(@NotNull String apiKey, @NotNull String query, int maxResults) {
        Objects.requireNonNull(apiKey, "apiKey must not be null");
        Objects.requireNonNull(query, "query must not be null");

        long startTime = System.currentTimeMillis();
        try {
            MDC.put(MDC_PROVIDER, "tavily");
            MDC.put(MDC_MAX_RESULTS, String.valueOf(maxResults));

            TavilySearchResponse response = client.search(TavilySearchRequest.of(apiKey, query, maxResults));
            RetrievalResultSet result = toResultSet(response);

            LOG.info("Web search completed - duration={}ms, results={}",
                System.currentTimeMillis() - startTime, result.chunks().size());
            return result;
        } finally {
            MDC.remove(MDC_PROVIDER);
            MDC.remove(MDC_MAX_RESULTS);
        }
    }

    /**
     * Fallback when the circuit breaker is open or the call fails.
     * Parameter types must match the main method.
     */
    @SuppressWarnings("unused")
    @NotNull
    RetrievalResultSet fallbackSearch(@NotNull String apiKey, @NotNull String query, int maxResults) {
        LOG.warn("Web search fallback triggered, continuing without web results");
        return RetrievalResultSet.empty();
    }

    @NotNull
    static RetrievalResultSet toResultSet(TavilySearchResponse response) {
        if (response == null || response.results() == null) {
            return RetrievalResultSet.empty();
        }
        List<RetrievalChunk> chunks = new ArrayList<>();
        for (TavilyResult hit : response.results()) {
            if (hit == null || hit.content() == null) {
                continue;
            }
            chunks.add(RetrievalChunk.of(hit.content(), hit.url(), hit.title()).with(SOURCE, hit.url()));
        }
        return RetrievalResultSet.of(chunks);
    }
}

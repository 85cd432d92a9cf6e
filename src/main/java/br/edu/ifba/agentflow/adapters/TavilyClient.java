package br.edu.ifba.agentflow.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * REST client interface for the Tavily search API.
 *
 * <p>This client is registered with the key "tavily" and configured via:
 * <pre>
 * quarkus.rest-client.tavily.url=https://api.tavily.com
 * quarkus.rest-client.tavily.read-timeout=5000
 * </pre>
 */
@RegisterRestClient(configKey = "tavily")
public interface TavilyClient {

    /**
     * Searches the web.
     *
     * @param request the search request, carrying the API key
     * @return ranked results
     */
    @POST
    @Path("/search")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    TavilySearchResponse search(TavilySearchRequest request);

    /**
     * Request body for the search API.
     *
     * @param apiKey      Tavily API key
     * @param query       search query
     * @param maxResults  maximum number of results
     * @param searchDepth "basic" or "advanced"
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TavilySearchRequest(
        @JsonProperty("api_key") String apiKey,
        String query,
        @JsonProperty("max_results") int maxResults,
        @JsonProperty("search_depth") String searchDepth
    ) {
        public static TavilySearchRequest of(String apiKey, String query, int maxResults) {
            return new TavilySearchRequest(apiKey, query, maxResults, "advanced");
        }
    }

    /**
     * Response from the search API.
     *
     * @param query   the query as executed
     * @param results ranked results
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record TavilySearchResponse(
        String query,
        List<TavilyResult> results
    ) {}

    /**
     * A single search hit.
     *
     * @param title   page title
     * @param url     page URL, used as document id
     * @param content extracted snippet
     * @param score   relevance score
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record TavilyResult(
        String title,
        String url,
        String content,
        Double score
    ) {}
}

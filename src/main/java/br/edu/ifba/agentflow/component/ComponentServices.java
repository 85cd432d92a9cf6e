package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.citation.CitationBackend;
import br.edu.ifba.agentflow.llm.GenerationBackendFactory;
import br.edu.ifba.agentflow.retrieval.RetrievalSource;
import br.edu.ifba.agentflow.retrieval.WebSearchSourceFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators handed to every stage at activation.
 *
 * @param generationBackends resolves chat models by id
 * @param citationBackend inserts citation markers into answers
 * @param graphSource graph-augmented retrieval source
 * @param webSearchSources creates web search sources from an API key
 * @param objectMapper binds parameters and (de)serializes chunk payloads
 * @param settings shared tunables
 * @param retrievalExecutor runs retrieval source calls
 */
public record ComponentServices(
    @NotNull GenerationBackendFactory generationBackends,
    @NotNull CitationBackend citationBackend,
    @NotNull RetrievalSource graphSource,
    @NotNull WebSearchSourceFactory webSearchSources,
    @NotNull ObjectMapper objectMapper,
    @NotNull ComponentSettings settings,
    @NotNull Executor retrievalExecutor
) {
    public ComponentServices {
        Objects.requireNonNull(generationBackends, "generationBackends must not be null");
        Objects.requireNonNull(citationBackend, "citationBackend must not be null");
        Objects.requireNonNull(graphSource, "graphSource must not be null");
        Objects.requireNonNull(webSearchSources, "webSearchSources must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(retrievalExecutor, "retrievalExecutor must not be null");
    }
}

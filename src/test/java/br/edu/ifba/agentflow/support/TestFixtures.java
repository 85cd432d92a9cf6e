package br.edu.ifba.agentflow.support;

import br.edu.ifba.agentflow.citation.CitationBackend;
import br.edu.ifba.agentflow.citation.KeywordOverlapCitationBackend;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentSettings;
import br.edu.ifba.agentflow.components.BuiltinComponents;
import br.edu.ifba.agentflow.engine.ConversationCanvas;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.retrieval.QuerySummaryGraphSource;
import br.edu.ifba.agentflow.retrieval.RetrievalResultSet;
import br.edu.ifba.agentflow.retrieval.WebSearchSourceFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds graphs, services and canvases wired to deterministic fakes.
 */
public final class TestFixtures {

    public static final String TENANT = "tenant-1";

    private TestFixtures() {
    }

    public static WorkflowGraph graph() {
        return new WorkflowGraph("test-flow", "test", BuiltinComponents.registry());
    }

    public static ComponentServices services(GenerationBackend backend) {
        return services(backend, apiKey -> (query, maxResults) -> RetrievalResultSet.empty(),
            new KeywordOverlapCitationBackend(0.2));
    }

    public static ComponentServices services(GenerationBackend backend, WebSearchSourceFactory webSearch) {
        return services(backend, webSearch, new KeywordOverlapCitationBackend(0.2));
    }

    public static ComponentServices services(GenerationBackend backend, WebSearchSourceFactory webSearch,
                                             CitationBackend citationBackend) {
        return new ComponentServices(
            (tenantId, llmId) -> backend,
            citationBackend,
            new QuerySummaryGraphSource(),
            webSearch,
            new ObjectMapper(),
            ComponentSettings.defaults(),
            Runnable::run);
    }

    public static ConversationCanvas canvas(WorkflowGraph graph, ComponentServices services) {
        return new ConversationCanvas(graph, BuiltinComponents.registry(), services, TENANT);
    }
}

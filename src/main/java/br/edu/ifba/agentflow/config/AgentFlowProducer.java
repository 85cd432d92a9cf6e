package br.edu.ifba.agentflow.config;

import br.edu.ifba.agentflow.citation.CitationBackend;
import br.edu.ifba.agentflow.citation.KeywordOverlapCitationBackend;
import br.edu.ifba.agentflow.component.ComponentRegistry;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentSettings;
import br.edu.ifba.agentflow.components.BuiltinComponents;
import br.edu.ifba.agentflow.graph.WorkflowDocumentCodec;
import br.edu.ifba.agentflow.llm.EmbeddingBackend;
import br.edu.ifba.agentflow.llm.GenerationBackendFactory;
import br.edu.ifba.agentflow.retrieval.QuerySummaryGraphSource;
import br.edu.ifba.agentflow.retrieval.WebSearchSourceFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CDI producers wiring the workflow core to the configured adapters.
 */
@ApplicationScoped
public class AgentFlowProducer {

    private static final Logger LOG = Logger.getLogger(AgentFlowProducer.class);

    /**
     * Name of the executor running backend and retrieval calls.
     */
    public static final String EXECUTOR = "agentflowExecutor";

    private static final ClassLoader QUARKUS_CLASSLOADER = AgentFlowProducer.class.getClassLoader();

    @Produces
    @Singleton
    ComponentSettings componentSettings(AgentFlowConfig config) {
        if (!config.isValid()) {
            throw new IllegalStateException("Invalid agentflow configuration: " + config.describe());
        }
        LOG.infof("Workflow settings: %s", config.describe());
        return ComponentSettings.from(config);
    }

    @Produces
    @Singleton
    ComponentRegistry componentRegistry() {
        ComponentRegistry registry = BuiltinComponents.registry();
        LOG.debugf("Registered component types: %s", registry.componentNames());
        return registry;
    }

    @Produces
    @Singleton
    CitationBackend citationBackend(AgentFlowConfig config, EmbeddingBackend embeddings) {
        return new KeywordOverlapCitationBackend(config.citation().threshold(), embeddings);
    }

    @Produces
    @Singleton
    WorkflowDocumentCodec workflowDocumentCodec(ObjectMapper objectMapper) {
        return new WorkflowDocumentCodec(objectMapper);
    }

    @Produces
    @Singleton
    ComponentServices componentServices(GenerationBackendFactory generationBackends,
                                        CitationBackend citationBackend,
                                        WebSearchSourceFactory webSearchSources,
                                        ObjectMapper objectMapper,
                                        ComponentSettings settings,
                                        @Named(EXECUTOR) ExecutorService executor) {
        return new ComponentServices(
            generationBackends,
            citationBackend,
            new QuerySummaryGraphSource(),
            webSearchSources,
            objectMapper,
            settings,
            executor);
    }

    /**
     * Threads carry the application classloader so REST clients and Jackson resolve
     * the same classes as the caller.
     */
    @Produces
    @Singleton
    @Named(EXECUTOR)
    ExecutorService executor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
                task.run();
            }, "agentflow-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    void closeExecutor(@Disposes @Named(EXECUTOR) ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            LOG.warn("Workflow executor did not terminate in time, forcing shutdown");
            executor.shutdownNow();
        }
    }
}

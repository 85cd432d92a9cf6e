package br.edu.ifba.agentflow.engine;

import br.edu.ifba.agentflow.component.ComponentRegistry;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.graph.WorkflowDocument;
import br.edu.ifba.agentflow.graph.WorkflowDocumentCodec;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Entry point for building, loading and running workflows.
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * WorkflowGraph graph = workflowService.load("support-bot", json);
 * ConversationCanvas canvas = workflowService.open(graph, tenantId);
 * canvas.runComponent("begin", false);
 * canvas.runComponent("answer", false);
 * canvas.addUserInput("What is the refund policy?");
 * canvas.runComponent("retrieval", false);
 * }</pre>
 */
@ApplicationScoped
public class WorkflowService {

    private static final Logger LOG = Logger.getLogger(WorkflowService.class);

    @Inject
    ComponentRegistry registry;

    @Inject
    ComponentServices services;

    @Inject
    WorkflowDocumentCodec codec;

    /**
     * Default constructor for CDI proxy.
     */
    public WorkflowService() {
    }

    public WorkflowService(@NotNull ComponentRegistry registry, @NotNull ComponentServices services,
                           @NotNull WorkflowDocumentCodec codec) {
        this.registry = registry;
        this.services = services;
        this.codec = codec;
    }

    /**
     * Creates an empty graph whose node types are checked against the registry.
     */
    @NotNull
    public WorkflowGraph create(@NotNull String workflowId, @Nullable String description) {
        return new WorkflowGraph(workflowId, description, registry);
    }

    /**
     * Parses a workflow document and builds its graph.
     *
     * @throws IllegalArgumentException if the text is not a valid document
     * @throws br.edu.ifba.agentflow.exception.UnknownComponentTypeException if a node type is not registered
     * @throws br.edu.ifba.agentflow.exception.NodeNotFoundException if an edge points at a missing node
     */
    @NotNull
    public WorkflowGraph load(@NotNull String workflowId, @NotNull String json) {
        WorkflowDocument document = codec.fromJson(json);
        WorkflowGraph graph = create(workflowId, null);
        graph.fromDocument(document);
        LOG.infof("Loaded workflow %s with %d components", workflowId, graph.getNodes().size());
        return graph;
    }

    @NotNull
    public String export(@NotNull WorkflowGraph graph, boolean pretty) {
        WorkflowDocument document = graph.toDocument();
        return pretty ? codec.toPrettyJson(document) : codec.toJson(document);
    }

    /**
     * Activates every node of the graph for one conversation.
     *
     * @throws br.edu.ifba.agentflow.exception.ConfigurationException if a node's parameters are invalid
     */
    @NotNull
    public ConversationCanvas open(@NotNull WorkflowGraph graph, @NotNull String tenantId) {
        LOG.debugf("Opening canvas for workflow %s, tenant %s", graph.getId(), tenantId);
        return new ConversationCanvas(graph, registry, services, tenantId);
    }

    @NotNull
    public Set<String> componentTypes() {
        return registry.componentNames();
    }
}

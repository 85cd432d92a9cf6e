package br.edu.ifba.agentflow.engine;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentRegistry;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.exception.NodeNotFoundException;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.graph.WorkflowNode;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory execution engine over one workflow graph.
 *
 * <p>Every node is activated when the canvas is created, so parameter errors surface before
 * the first turn. The caller decides which node runs next; the canvas records the path,
 * keeps the conversation history and hands each stage its upstream output.</p>
 *
 * <p>Not thread-safe: one conversation, one node at a time.</p>
 */
public class ConversationCanvas implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(ConversationCanvas.class);

    private final WorkflowGraph graph;
    private final String tenantId;
    private final Map<String, Component<?>> components = new LinkedHashMap<>();
    private final Map<String, ComponentInfo> componentInfo = new LinkedHashMap<>();
    @Nullable
    private String embeddingModel;

    /**
     * @throws br.edu.ifba.agentflow.exception.UnknownComponentTypeException if a node type is not registered
     * @throws br.edu.ifba.agentflow.exception.ConfigurationException if a node's parameters are invalid
     */
    public ConversationCanvas(@NotNull WorkflowGraph graph, @NotNull ComponentRegistry registry,
                              @NotNull ComponentServices services, @NotNull String tenantId) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(services, "services must not be null");

        for (WorkflowNode node : graph.getNodes()) {
            components.put(node.getId(),
                registry.activate(node.getId(), node.getComponentName(), node.getParams(), this, services));
        }
        logger.debugf("Canvas for workflow '%s' activated %d components", graph.getId(), components.size());
    }

    // ========================================================================
    // Conversation driving
    // ========================================================================

    /**
     * Records a user turn. When the trace last stopped at an answer node, that node's output
     * becomes the user's message, so downstream stages read it as their input.
     */
    public void addUserInput(@NotNull String question) {
        graph.history().add(ChatMessage.user(question));
        List<String> path = graph.path();
        if (!path.isEmpty()) {
            String last = path.get(path.size() - 1);
            if (ComponentTypes.isAnswer(getComponentName(last))) {
                getComponent(last).setOutput(Component.beOutput(question));
            }
        }
    }

    /**
     * Runs one node and appends it to the path. A settled answer node adds its content
     * to the history as an assistant turn.
     *
     * @param componentId node to run
     * @param stream whether the caller can consume a stream
     * @throws NodeNotFoundException if no such node exists
     */
    @NotNull
    public StageOutput runComponent(@NotNull String componentId, boolean stream) {
        Component<?> component = getComponent(componentId);
        graph.path().add(componentId);
        logger.debugf("Running %s", component);

        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put(Component.STREAM, stream);
        StageOutput output = component.run(List.copyOf(graph.history()), kwargs);

        if (output instanceof StageOutput.Settled settled && ComponentTypes.isAnswer(component.getComponentName())) {
            recordAnswer(settled.result());
        }
        return output;
    }

    /**
     * Clears the conversation state and every cached output. The graph itself is kept.
     */
    public void reset() {
        graph.history().clear();
        graph.messages().clear();
        graph.reference().clear();
        graph.path().clear();
        graph.answer().clear();
        componentInfo.clear();
        components.values().forEach(Component::reset);
    }

    @NotNull
    public WorkflowGraph getGraph() {
        return graph;
    }

    @NotNull
    public Optional<ComponentInfo> getComponentInfo(@NotNull String componentId) {
        return Optional.ofNullable(componentInfo.get(componentId));
    }

    @NotNull
    public List<String> getPath() {
        return Collections.unmodifiableList(graph.path());
    }

    // ========================================================================
    // WorkflowEngine
    // ========================================================================

    @Override
    @NotNull
    public Component<?> getComponent(@NotNull String componentId) {
        Component<?> component = components.get(componentId);
        if (component == null) {
            throw new NodeNotFoundException("Component not found: " + componentId);
        }
        return component;
    }

    @Override
    @Nullable
    public String getComponentName(@NotNull String componentId) {
        return graph.findNode(componentId).map(WorkflowNode::getComponentName).orElse(null);
    }

    @Override
    @NotNull
    public List<String> getDownstream(@NotNull String componentId) {
        return graph.getNode(componentId).getDownstream();
    }

    @Override
    @NotNull
    public List<ChatMessage> getHistory(int windowSize) {
        List<ChatMessage> history = graph.history();
        if (windowSize <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - windowSize);
        return List.copyOf(history.subList(from, history.size()));
    }

    /**
     * Picks the upstream node that ran most recently on the path; falls back to the first
     * upstream when none of them has run.
     */
    @Override
    @NotNull
    public ComponentResult getInput(@NotNull String componentId) {
        List<String> upstream = graph.getNode(componentId).getUpstream();
        if (upstream.isEmpty()) {
            return ComponentResult.empty();
        }
        String source = upstream.get(0);
        List<String> path = graph.path();
        for (int i = path.size() - 1; i >= 0; i--) {
            if (upstream.contains(path.get(i))) {
                source = path.get(i);
                break;
            }
        }
        return getComponent(source).output(false);
    }

    @Override
    public void setComponentInfo(@NotNull String componentId, @NotNull ComponentInfo info) {
        componentInfo.put(componentId, info);
    }

    @Override
    @NotNull
    public String getTenantId() {
        return tenantId;
    }

    @Override
    @Nullable
    public String getEmbeddingModel() {
        return embeddingModel;
    }

    @Override
    public void setEmbeddingModel(@Nullable String modelId) {
        this.embeddingModel = modelId;
    }

    @Override
    public void updateLatestUserTurn(@NotNull String question) {
        List<ChatMessage> history = graph.history();
        ChatMessage turn = ChatMessage.user(question);
        if (!history.isEmpty()) {
            ChatMessage last = history.get(history.size() - 1);
            if (last.equals(turn)) {
                return;
            }
            if (last.role() == ChatMessage.Role.USER) {
                history.set(history.size() - 1, turn);
                return;
            }
        }
        history.add(turn);
    }

    private void recordAnswer(ComponentResult result) {
        if (!result.hasContent()) {
            return;
        }
        String content = String.join("\n", result.contents());
        graph.history().add(ChatMessage.assistant(content));
        graph.answer().add(content);

        ResultRow first = result.first();
        if (first != null && first.reference() != null && !first.reference().isEmpty()) {
            graph.reference().add(first.reference());
        }
    }
}

package br.edu.ifba.agentflow.graph;

import br.edu.ifba.agentflow.exception.DuplicateNodeIdException;
import br.edu.ifba.agentflow.exception.NodeNotFoundException;
import br.edu.ifba.agentflow.exception.UnknownComponentTypeException;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative graph of typed stages.
 *
 * <p>Holds the node mapping plus the conversation state the execution engine keeps
 * between turns: history, messages, reference, path and the pending-answer queue.
 * Every id that appears in an upstream or downstream list is a key of the node mapping.</p>
 */
public class WorkflowGraph {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowGraph.class);

    private final String id;
    private String description;
    private final ComponentTypeCatalog catalog;
    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();

    private final List<ChatMessage> history = new ArrayList<>();
    private final List<Object> messages = new ArrayList<>();
    private final List<Object> reference = new ArrayList<>();
    private final List<String> path = new ArrayList<>();
    private final List<String> answer = new ArrayList<>();

    public WorkflowGraph(@NotNull String id, @Nullable String description, @NotNull ComponentTypeCatalog catalog) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.description = description != null ? description : "";
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description != null ? description : "";
    }

    // ========================================================================
    // Authoring
    // ========================================================================

    /**
     * Adds a node with no edges.
     *
     * @throws DuplicateNodeIdException if the id is taken
     * @throws UnknownComponentTypeException if the type is not registered
     */
    public WorkflowNode addNode(@NotNull String nodeId, @NotNull String componentName,
                                @Nullable Map<String, Object> params) {
        if (nodes.containsKey(nodeId)) {
            throw new DuplicateNodeIdException("Node '" + nodeId + "' already exists");
        }
        requireRegistered(componentName);
        WorkflowNode node = new WorkflowNode(nodeId, componentName, params);
        nodes.put(nodeId, node);
        logger.debug("Added node {} ({})", nodeId, componentName);
        return node;
    }

    /**
     * Adds an edge. Connecting an already connected pair is a no-op.
     */
    public void connect(@NotNull String upstreamId, @NotNull String downstreamId) {
        WorkflowNode from = requireNode(upstreamId);
        WorkflowNode to = requireNode(downstreamId);
        from.addDownstream(downstreamId);
        to.addUpstream(upstreamId);
    }

    /**
     * Removes an edge. Disconnecting a pair that is not connected is a no-op.
     */
    public void disconnect(@NotNull String upstreamId, @NotNull String downstreamId) {
        WorkflowNode from = requireNode(upstreamId);
        WorkflowNode to = requireNode(downstreamId);
        from.removeDownstream(downstreamId);
        to.removeUpstream(upstreamId);
    }

    /**
     * Removes a node together with every edge that references it.
     * Children that used it as parent become top-level nodes.
     */
    public void removeNode(@NotNull String nodeId) {
        requireNode(nodeId);
        nodes.remove(nodeId);
        for (WorkflowNode other : nodes.values()) {
            other.removeUpstream(nodeId);
            other.removeDownstream(nodeId);
            if (nodeId.equals(other.getParentId())) {
                other.setParentId(null);
            }
        }
        logger.debug("Removed node {}", nodeId);
    }

    /**
     * Shallow-merges the patch into the node parameters.
     */
    public void setParameters(@NotNull String nodeId, @NotNull Map<String, Object> patch) {
        requireNode(nodeId).mergeParams(patch);
    }

    /**
     * Scopes a node inside another one, or clears the scope when {@code parentId} is null.
     *
     * @throws IllegalArgumentException if the assignment would make the node its own ancestor
     */
    public void setParent(@NotNull String nodeId, @Nullable String parentId) {
        WorkflowNode node = requireNode(nodeId);
        if (parentId == null) {
            node.setParentId(null);
            return;
        }
        requireNode(parentId);
        if (reachesThroughParents(nodes, parentId, nodeId)) {
            throw new IllegalArgumentException(
                String.format("Node '%s' cannot be scoped inside its own descendant '%s'", nodeId, parentId));
        }
        node.setParentId(parentId);
    }

    /**
     * Walks the parent chain starting at {@code from} and reports whether it passes {@code target}.
     */
    private static boolean reachesThroughParents(Map<String, WorkflowNode> nodes, String from, String target) {
        String cursor = from;
        Set<String> seen = new HashSet<>();
        while (cursor != null && seen.add(cursor)) {
            if (cursor.equals(target)) {
                return true;
            }
            WorkflowNode ancestor = nodes.get(cursor);
            cursor = ancestor != null ? ancestor.getParentId() : null;
        }
        return false;
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    @NotNull
    public WorkflowNode getNode(@NotNull String nodeId) {
        return requireNode(nodeId);
    }

    @NotNull
    public Optional<WorkflowNode> findNode(@NotNull String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(@NotNull String nodeId) {
        return nodes.containsKey(nodeId);
    }

    @NotNull
    public Collection<WorkflowNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    // ========================================================================
    // Conversation state owned by the execution engine
    // ========================================================================

    public List<ChatMessage> history() {
        return history;
    }

    public List<Object> messages() {
        return messages;
    }

    public List<Object> reference() {
        return reference;
    }

    public List<String> path() {
        return path;
    }

    public List<String> answer() {
        return answer;
    }

    // ========================================================================
    // Wire format
    // ========================================================================

    @NotNull
    public WorkflowDocument toDocument() {
        Map<String, WorkflowDocument.ComponentEntry> components = new LinkedHashMap<>();
        for (WorkflowNode node : nodes.values()) {
            components.put(node.getId(), new WorkflowDocument.ComponentEntry(
                new WorkflowDocument.ComponentObject(node.getComponentName(), node.getParams()),
                node.getDownstream(),
                node.getUpstream(),
                node.getParentId() != null ? node.getParentId() : ""
            ));
        }
        return new WorkflowDocument(components, history, messages, reference, path, answer);
    }

    /**
     * Replaces the content of this graph with the given document.
     * The document is validated first; on failure the graph is left untouched.
     *
     * @throws IllegalArgumentException if the document has no components mapping or its parent scopes form a cycle
     * @throws UnknownComponentTypeException if a node names an unregistered type
     * @throws NodeNotFoundException if an edge or parent references a missing node
     */
    public void fromDocument(@NotNull WorkflowDocument document) {
        Map<String, WorkflowDocument.ComponentEntry> components = document.components();
        if (components == null) {
            throw new IllegalArgumentException("Workflow document has no 'components' mapping");
        }

        Map<String, WorkflowNode> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, WorkflowDocument.ComponentEntry> entry : components.entrySet()) {
            WorkflowDocument.ComponentEntry component = entry.getValue();
            if (component == null || component.obj() == null || component.obj().componentName() == null) {
                throw new IllegalArgumentException("Component '" + entry.getKey() + "' has no component_name");
            }
            requireRegistered(component.obj().componentName());
            loaded.put(entry.getKey(),
                new WorkflowNode(entry.getKey(), component.obj().componentName(), component.obj().params()));
        }

        for (Map.Entry<String, WorkflowDocument.ComponentEntry> entry : components.entrySet()) {
            WorkflowNode node = loaded.get(entry.getKey());
            WorkflowDocument.ComponentEntry component = entry.getValue();
            for (String up : component.upstream()) {
                requireIn(loaded, up, entry.getKey());
                node.addUpstream(up);
            }
            for (String down : component.downstream()) {
                requireIn(loaded, down, entry.getKey());
                node.addDownstream(down);
            }
            if (!component.parentId().isEmpty()) {
                requireIn(loaded, component.parentId(), entry.getKey());
                node.setParentId(component.parentId());
            }
        }
        for (WorkflowNode node : loaded.values()) {
            if (node.getParentId() != null && reachesThroughParents(loaded, node.getParentId(), node.getId())) {
                throw new IllegalArgumentException(
                    String.format("Node '%s' is scoped inside its own descendant '%s'", node.getId(), node.getParentId()));
            }
        }

        nodes.clear();
        nodes.putAll(loaded);
        history.clear();
        history.addAll(document.history());
        messages.clear();
        messages.addAll(document.messages());
        reference.clear();
        reference.addAll(document.reference());
        path.clear();
        path.addAll(document.path());
        answer.clear();
        answer.addAll(document.answer());
        logger.debug("Loaded workflow {} with {} nodes", id, nodes.size());
    }

    private static void requireIn(Map<String, WorkflowNode> loaded, String referenced, String owner) {
        if (!loaded.containsKey(referenced)) {
            throw new NodeNotFoundException(
                String.format("Node '%s' references missing node '%s'", owner, referenced));
        }
    }

    private WorkflowNode requireNode(String nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new NodeNotFoundException("Node '" + nodeId + "' not found");
        }
        return node;
    }

    private void requireRegistered(String componentName) {
        if (!catalog.isRegistered(componentName)) {
            throw new UnknownComponentTypeException("Unknown component type: " + componentName);
        }
    }
}

package br.edu.ifba.agentflow.graph;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the workflow graph. Edges and parent are only changed through {@link WorkflowGraph}.
 */
public final class WorkflowNode {

    private final String id;
    private final String componentName;
    private final Map<String, Object> params;
    private final List<String> upstream = new ArrayList<>();
    private final List<String> downstream = new ArrayList<>();
    @Nullable
    private String parentId;

    WorkflowNode(@NotNull String id, @NotNull String componentName, @Nullable Map<String, Object> params) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.componentName = Objects.requireNonNull(componentName, "componentName must not be null");
        this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getComponentName() {
        return componentName;
    }

    /**
     * @return read-only view of the parameters
     */
    @NotNull
    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    @NotNull
    public List<String> getUpstream() {
        return Collections.unmodifiableList(upstream);
    }

    @NotNull
    public List<String> getDownstream() {
        return Collections.unmodifiableList(downstream);
    }

    @Nullable
    public String getParentId() {
        return parentId;
    }

    void mergeParams(@NotNull Map<String, Object> patch) {
        params.putAll(patch);
    }

    void addUpstream(String nodeId) {
        if (!upstream.contains(nodeId)) {
            upstream.add(nodeId);
        }
    }

    void addDownstream(String nodeId) {
        if (!downstream.contains(nodeId)) {
            downstream.add(nodeId);
        }
    }

    void removeUpstream(String nodeId) {
        upstream.remove(nodeId);
    }

    void removeDownstream(String nodeId) {
        downstream.remove(nodeId);
    }

    void setParentId(@Nullable String parentId) {
        this.parentId = parentId;
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
            "id='" + id + '\'' +
            ", componentName='" + componentName + '\'' +
            ", upstream=" + upstream +
            ", downstream=" + downstream +
            ", parentId='" + parentId + '\'' +
            '}';
    }
}

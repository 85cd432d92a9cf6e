package br.edu.ifba.agentflow.graph;

import br.edu.ifba.agentflow.llm.ChatMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Wire format of a workflow.
 *
 * <pre>
 * {
 *   "components": {
 *     "Retrieval:0": {
 *       "obj": {"component_name": "Retrieval", "params": {...}},
 *       "downstream": ["Generate:0"],
 *       "upstream": ["Answer:0"],
 *       "parent_id": ""
 *     }
 *   },
 *   "history": [["user", "hi"]],
 *   "messages": [],
 *   "reference": [],
 *   "path": [],
 *   "answer": []
 * }
 * </pre>
 */
@JsonPropertyOrder({"components", "history", "messages", "reference", "path", "answer"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDocument(
    Map<String, ComponentEntry> components,
    List<ChatMessage> history,
    List<Object> messages,
    List<Object> reference,
    List<String> path,
    List<String> answer
) {

    public WorkflowDocument {
        components = components != null ? new LinkedHashMap<>(components) : null;
        history = compact(history);
        messages = compact(messages);
        reference = compact(reference);
        path = compact(path);
        answer = compact(answer);
    }

    /**
     * Immutable copy without null elements; a missing list reads as empty.
     */
    static <T> List<T> compact(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    @JsonPropertyOrder({"obj", "downstream", "upstream", "parent_id"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentEntry(
        ComponentObject obj,
        List<String> downstream,
        List<String> upstream,
        @JsonProperty("parent_id")
        String parentId
    ) {
        public ComponentEntry {
            downstream = compact(downstream);
            upstream = compact(upstream);
            parentId = parentId != null ? parentId : "";
        }
    }

    @JsonPropertyOrder({"component_name", "params"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentObject(
        @JsonProperty("component_name")
        String componentName,
        Map<String, Object> params
    ) {
        public ComponentObject {
            params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        }
    }
}

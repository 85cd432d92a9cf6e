package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.components.BeginParam;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves prompt placeholders against the execution engine.
 *
 * <ul>
 *   <li>{@code begin@key}: value of that query parameter of the entry node, empty if absent</li>
 *   <li>an answer node: text of the most recent history entry</li>
 *   <li>any other node: its settled output as a bulleted block; retrieval outputs are also
 *       collected for citation</li>
 * </ul>
 */
public class PromptVariableResolver {

    private static final Logger logger = LoggerFactory.getLogger(PromptVariableResolver.class);

    private final WorkflowEngine engine;

    public PromptVariableResolver(@NotNull WorkflowEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Keeps the user element, every begin reference, and node references that exist in the graph,
     * each named after what it points to.
     */
    @NotNull
    public List<PromptInputElement> describe(@NotNull List<PromptInputElement> elements) {
        List<PromptInputElement> described = new ArrayList<>();
        for (PromptInputElement element : elements) {
            switch (element.kind()) {
                case LITERAL -> described.add(element);
                case BEGIN_PARAM_REF -> described.add(element.withName(
                    beginParam(element.nodeId())
                        .flatMap(param -> param.findQuery(element.paramKey()))
                        .map(BeginParam.QueryEntry::name)
                        .orElse(element.paramKey())));
                case NODE_REF -> {
                    String name = engine.getComponentName(element.key());
                    if (name == null) {
                        logger.debug("Placeholder {} does not name a node, left as text", element.key());
                    } else {
                        described.add(element.withName(name));
                    }
                }
            }
        }
        return described;
    }

    /**
     * Resolves every element except the user literal, in order.
     */
    @NotNull
    public ResolvedInputs resolve(@NotNull List<PromptInputElement> elements) {
        Map<String, String> values = new LinkedHashMap<>();
        List<ComponentResult> retrievals = new ArrayList<>();
        List<Map<String, Object>> log = new ArrayList<>();

        for (PromptInputElement element : elements) {
            if (element.kind() == PromptInputElement.Kind.LITERAL) {
                continue;
            }
            String value = element.kind() == PromptInputElement.Kind.BEGIN_PARAM_REF
                ? resolveBeginParam(element)
                : resolveNode(element, retrievals);
            values.put(element.key(), value);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("component_id", element.key());
            entry.put("content", value);
            log.add(entry);
        }
        return new ResolvedInputs(values, retrievals, log);
    }

    private String resolveBeginParam(PromptInputElement element) {
        String paramKey = element.paramKey();
        Optional<String> value = beginParam(element.nodeId())
            .flatMap(param -> param.findQuery(paramKey))
            .map(BeginParam.QueryEntry::valueAsText);
        if (value.isEmpty()) {
            logger.warn("Parameter '{}' not found in entry node '{}' for placeholder {}; using empty string",
                paramKey, element.nodeId(), element.key());
            return "";
        }
        return value.get();
    }

    private String resolveNode(PromptInputElement element, List<ComponentResult> retrievals) {
        Component<?> component = engine.getComponent(element.key());
        if (ComponentTypes.isAnswer(component.getComponentName())) {
            List<ChatMessage> latest = engine.getHistory(1);
            return latest.isEmpty() ? "" : latest.get(latest.size() - 1).content();
        }

        ComponentResult output = component.output(false);
        if (output.isEmpty()) {
            return "";
        }
        if (ComponentTypes.isRetrieval(component.getComponentName())) {
            retrievals.add(output);
        }
        return PromptTemplate.bullets(output.contents());
    }

    private Optional<BeginParam> beginParam(String nodeId) {
        if (engine.getComponentName(nodeId) == null) {
            return Optional.empty();
        }
        Object param = engine.getComponent(nodeId).getParam();
        return param instanceof BeginParam begin ? Optional.of(begin) : Optional.empty();
    }
}

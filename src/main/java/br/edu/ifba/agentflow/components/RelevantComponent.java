package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.prompt.FittedPrompt;
import br.edu.ifba.agentflow.utils.TokenUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Grades whether the upstream content is relevant to the latest user question
 * and emits the configured {@code yes} or {@code no} output. Never fails on an
 * ambiguous grade: anything without "yes" or "no" counts as "no".
 */
public class RelevantComponent extends GenerateComponent<RelevantParam> {

    private static final Logger logger = LoggerFactory.getLogger(RelevantComponent.class);

    public RelevantComponent(String id, RelevantParam param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.RELEVANT;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        String documents = String.join(" - ", getInput().contents());
        if (documents.isEmpty()) {
            return StageOutput.settled(beOutput(param.getNo()));
        }

        GenerationBackend backend = backend();
        String text = "Question: " + latestQuestion() + "\nDocuments: \n" + documents;
        int limit = TokenUtil.charBudget(backend.maxLength(),
            services.settings().relevanceCharsPerToken(), services.settings().relevanceReservedChars());
        if (text.length() > limit) {
            logger.warn("Relevance input of {} chars exceeds the estimated limit of {} chars, truncating",
                text.length(), limit);
            text = text.substring(0, Math.max(0, limit - 3)) + "...";
        }

        String grade = call(backend, new FittedPrompt(param.getPrompt(), List.of(ChatMessage.user(text))),
            param.genConf());
        logger.debug("Relevance grade from backend: {}", grade);

        String lower = grade.toLowerCase(Locale.ROOT);
        if (lower.contains("yes")) {
            return StageOutput.settled(beOutput(param.getYes()));
        }
        if (!lower.contains("no")) {
            logger.warn("Ambiguous relevance grade '{}', defaulting to 'no'", grade);
        }
        return StageOutput.settled(beOutput(param.getNo()));
    }

    @Override
    @NotNull
    public ComponentResult debug(@NotNull Map<String, Object> inputs) {
        return ((StageOutput.Settled) execute(List.of(), inputs)).result();
    }

    private String latestQuestion() {
        List<ChatMessage> history = engine.getHistory(Integer.MAX_VALUE);
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == ChatMessage.Role.USER) {
                return history.get(i).content();
            }
        }
        return "";
    }
}

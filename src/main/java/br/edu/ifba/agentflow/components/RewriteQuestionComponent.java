package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Owns the latest user turn. The rewrite backend is not wired, so the question passes through
 * unchanged; the engine's latest user turn is still set to it.
 */
public class RewriteQuestionComponent extends GenerateComponent<RewriteQuestionParam> {

    private static final Logger logger = LoggerFactory.getLogger(RewriteQuestionComponent.class);

    public RewriteQuestionComponent(String id, RewriteQuestionParam param, WorkflowEngine engine,
                                    ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.REWRITE_QUESTION;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        ResultRow first = getInput().first();
        String question = first != null ? first.content() : "";
        logger.debug("Question rewrite ({}) is disabled, passing through: {}",
            param.getLanguage().isEmpty() ? "same language" : param.getLanguage(), question);

        engine.updateLatestUserTurn(question);
        return StageOutput.settled(beOutput(question));
    }

    @Override
    @NotNull
    public ComponentResult debug(@NotNull Map<String, Object> inputs) {
        return ((StageOutput.Settled) execute(List.of(), inputs)).result();
    }
}

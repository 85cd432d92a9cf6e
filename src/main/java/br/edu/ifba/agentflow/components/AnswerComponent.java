package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Surfaces the upstream output to the user. Also the anchor for the latest user turn:
 * the engine sets its output to the user's message when the user speaks.
 */
public class AnswerComponent extends Component<AnswerParam> {

    public AnswerComponent(String id, AnswerParam param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.ANSWER;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        ComponentResult input = getInput();
        if (param.getPostAnswers().isEmpty()) {
            return StageOutput.settled(input);
        }
        List<ResultRow> rows = new ArrayList<>(input.rows());
        for (String postAnswer : param.getPostAnswers()) {
            rows.add(ResultRow.of(postAnswer));
        }
        return StageOutput.settled(new ComponentResult(rows));
    }
}

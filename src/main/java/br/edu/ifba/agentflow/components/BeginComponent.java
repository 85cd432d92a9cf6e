package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Entry node. Emits the prologue.
 */
public class BeginComponent extends Component<BeginParam> {

    public BeginComponent(String id, BeginParam param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.BEGIN;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        return StageOutput.settled(beOutput(param.getPrologue()));
    }
}

package br.edu.ifba.agentflow.engine;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.exception.NodeNotFoundException;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Execution engine as seen by a stage.
 *
 * <p>The engine owns the graph and the conversation state and advances one node at a time.
 * Stages read upstream outputs and history through it and never mutate its state
 * except through the methods below.</p>
 */
public interface WorkflowEngine {

    /**
     * @throws NodeNotFoundException if no such node exists
     */
    @NotNull
    Component<?> getComponent(@NotNull String componentId);

    /**
     * @return the component type name, or null if no such node exists
     */
    @Nullable
    String getComponentName(@NotNull String componentId);

    /**
     * @throws NodeNotFoundException if no such node exists
     */
    @NotNull
    List<String> getDownstream(@NotNull String componentId);

    /**
     * @param windowSize number of most recent entries to return
     */
    @NotNull
    List<ChatMessage> getHistory(int windowSize);

    /**
     * @return settled output of the immediate upstream stage, empty when there is none
     */
    @NotNull
    ComponentResult getInput(@NotNull String componentId);

    void setComponentInfo(@NotNull String componentId, @NotNull ComponentInfo info);

    @NotNull
    String getTenantId();

    @Nullable
    String getEmbeddingModel();

    void setEmbeddingModel(@Nullable String modelId);

    /**
     * Makes {@code question} the most recent user turn: no-op if it already is,
     * replaces a trailing user turn, appends otherwise.
     */
    void updateLatestUserTurn(@NotNull String question);
}

package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed processing stage of the workflow.
 *
 * <p>Subclasses implement {@link #execute(List, Map)}. This class caches the settled output,
 * keeps track of a pending stream, and exposes the upstream input through the engine.</p>
 *
 * @param <P> parameter type
 */
public abstract class Component<P extends ComponentParam> {

    /**
     * Keyword input that requests streaming output.
     */
    public static final String STREAM = "stream";

    protected final String id;
    protected final P param;
    protected final WorkflowEngine engine;
    protected final ComponentServices services;

    private ComponentResult output = ComponentResult.empty();
    @Nullable
    private ComponentStream stream;

    protected Component(@NotNull String id, @NotNull P param,
                        @NotNull WorkflowEngine engine, @NotNull ComponentServices services) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.param = Objects.requireNonNull(param, "param must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.services = Objects.requireNonNull(services, "services must not be null");
    }

    @NotNull
    public abstract String getComponentName();

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public P getParam() {
        return param;
    }

    /**
     * Validates the parameters.
     */
    public void check() {
        param.check();
    }

    /**
     * Runs the stage. A settled result is cached immediately; a stream is cached
     * once the caller drains it.
     *
     * @param history conversation history at the time of the call
     * @param kwargs keyword inputs, e.g. {@link #STREAM}
     */
    @NotNull
    public final StageOutput run(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        stream = null;
        StageOutput result = execute(history, kwargs);
        if (result instanceof StageOutput.Streaming streaming) {
            stream = streaming.stream();
        } else if (result instanceof StageOutput.Settled settled) {
            output = settled.result();
        }
        return result;
    }

    @NotNull
    protected abstract StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs);

    /**
     * Runs the same algorithm with inputs supplied directly instead of resolved from the graph.
     */
    @NotNull
    public ComponentResult debug(@NotNull Map<String, Object> inputs) {
        StageOutput result = execute(List.of(), inputs);
        if (result instanceof StageOutput.Streaming streaming) {
            return ComponentResult.of(streaming.stream().drain());
        }
        return ((StageOutput.Settled) result).result();
    }

    /**
     * @param allowPartial whether the last observed event of an undrained stream is acceptable
     * @throws IllegalStateException if a stream is pending and partial output is not allowed
     */
    @NotNull
    public ComponentResult output(boolean allowPartial) {
        if (stream != null && !stream.isDrained()) {
            if (!allowPartial) {
                throw new IllegalStateException(
                    "Output of '" + id + "' is not settled: its stream has not been drained");
            }
            return ComponentResult.of(stream.lastRow());
        }
        return output;
    }

    @NotNull
    public ComponentResult output() {
        return output(false);
    }

    public void setOutput(@NotNull ComponentResult result) {
        this.stream = null;
        this.output = Objects.requireNonNull(result, "result must not be null");
    }

    public void reset() {
        stream = null;
        output = ComponentResult.empty();
    }

    /**
     * @return settled output of the immediate upstream stage
     */
    @NotNull
    public ComponentResult getInput() {
        return engine.getInput(id);
    }

    @NotNull
    public static ComponentResult beOutput(@NotNull String content) {
        return ComponentResult.of(ResultRow.of(content));
    }

    protected ComponentStream openStream(@NotNull Iterator<StreamEvent> events) {
        return new ComponentStream(events, row -> output = ComponentResult.of(row));
    }

    protected static boolean streamRequested(@NotNull Map<String, Object> kwargs) {
        Object value = kwargs.get(STREAM);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @Override
    public String toString() {
        return getComponentName() + "{id='" + id + "'}";
    }
}

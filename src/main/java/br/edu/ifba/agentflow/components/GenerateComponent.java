package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.citation.CitationAssembler;
import br.edu.ifba.agentflow.citation.EmbeddingModelRef;
import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.component.StreamEvent;
import br.edu.ifba.agentflow.engine.ComponentInfo;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.exception.BackendFailureException;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.prompt.ChatPromptBuilder;
import br.edu.ifba.agentflow.prompt.FittedPrompt;
import br.edu.ifba.agentflow.prompt.PromptInputElement;
import br.edu.ifba.agentflow.prompt.PromptTemplate;
import br.edu.ifba.agentflow.prompt.PromptVariableResolver;
import br.edu.ifba.agentflow.prompt.ResolvedInputs;
import br.edu.ifba.agentflow.retrieval.Reference;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Generates an answer from a prompt template filled with upstream outputs.
 *
 * <p>Run flow:</p>
 * <ol>
 *   <li>Resolve the template placeholders and substitute them.</li>
 *   <li>If the referenced retrieval results hold no content, reply with the "nothing found"
 *       message without calling the backend.</li>
 *   <li>Fit system prompt and recent history into the backend budget and call it.</li>
 *   <li>Attach citations when the answer was grounded on retrieved chunks.</li>
 * </ol>
 *
 * <p>When the caller asks for streaming and the only successor is an answer node,
 * the result is a stream of partial answers ending with the final, cited one.</p>
 *
 * @param <P> parameter type
 */
public class GenerateComponent<P extends GenerateParam> extends Component<P> {

    private static final Logger logger = LoggerFactory.getLogger(GenerateComponent.class);

    private static final Pattern THINK_BLOCK = Pattern.compile("^.*</think>", Pattern.DOTALL);

    static final String DEBUG_USER_TURN = "Debug input: Output please.";

    protected final ChatPromptBuilder promptBuilder;
    protected final PromptVariableResolver resolver;
    protected final CitationAssembler citationAssembler;

    public GenerateComponent(String id, P param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
        this.promptBuilder = new ChatPromptBuilder(services.settings());
        this.resolver = new PromptVariableResolver(engine);
        this.citationAssembler = new CitationAssembler(
            services.citationBackend(), services.objectMapper(), services.settings());
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.GENERATE;
    }

    /**
     * @return the user element followed by the placeholders that point at something in the graph
     */
    @NotNull
    public List<PromptInputElement> getInputElements() {
        return resolver.describe(PromptTemplate.extractInputElements(param.getPrompt()));
    }

    /**
     * @return ids of the nodes the template depends on, answer and begin anchors excluded
     */
    @NotNull
    public List<String> getDependentComponents() {
        List<PromptInputElement> elements = getInputElements();
        return PromptTemplate.dependencies(elements.subList(1, elements.size()));
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        Map<String, String> vars = new LinkedHashMap<>();
        kwargs.forEach((key, value) -> {
            if (!STREAM.equals(key) && value != null) {
                vars.put(key, value.toString());
            }
        });

        ResolvedInputs resolved = resolver.resolve(getInputElements());
        vars.putAll(resolved.values());
        param.setInputs(resolved.inputLog());

        String prompt = renderPrompt(vars);
        ComponentResult retrieval = resolved.mergedRetrieval();

        if (streamsToAnswer(kwargs)) {
            logger.debug("{} streams its answer", id);
            return StageOutput.streaming(openStream(new GenerationStream(prompt, retrieval)));
        }

        if (!retrieval.hasRetrievedContent()) {
            String message = emptyResponse(retrieval, services.settings().emptyResponse());
            logger.info("Retrieval result is empty for {}, replying with: '{}'", id, message);
            return StageOutput.settled(ComponentResult.of(new ResultRow(message, Reference.empty())));
        }

        GenerationBackend backend = backend();
        FittedPrompt fitted = promptBuilder.build(
            prompt, engine.getHistory(param.getMessageHistoryWindowSize()), backend.maxLength(), backend.lengthUnit());
        Map<String, Object> conf = param.genConf();

        String answer = stripReasoning(call(backend, fitted, conf));
        engine.setComponentInfo(id, new ComponentInfo(fitted.systemPrompt(), fitted.messages(), conf));

        return StageOutput.settled(ComponentResult.of(finish(retrieval, answer)));
    }

    /**
     * Fills the template with {@code debug_inputs} and the supplied values, literally, and asks
     * the backend with a single user turn taken from {@code user}.
     */
    @Override
    @NotNull
    public ComponentResult debug(@NotNull Map<String, Object> inputs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map<String, Object> entry : param.getDebugInputs()) {
            if (entry != null && entry.get("key") != null && entry.containsKey("value")) {
                values.put(entry.get("key").toString(), entry.get("value"));
            }
        }
        values.putAll(inputs);

        String prompt = param.getPrompt();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String placeholder = "{" + entry.getKey() + "}";
            if (prompt.contains(placeholder)) {
                prompt = prompt.replace(placeholder, String.valueOf(entry.getValue()).replace("\\", " "));
            } else {
                logger.debug("Placeholder {} not found in prompt template", placeholder);
            }
        }

        Object user = values.get(PromptInputElement.USER_KEY);
        String userTurn = user != null ? user.toString() : DEBUG_USER_TURN;

        String answer = call(backend(), new FittedPrompt(prompt, List.of(ChatMessage.user(userTurn))), param.genConf());
        return beOutput(answer);
    }

    // ========================================================================
    // Shared with subclasses
    // ========================================================================

    @NotNull
    protected GenerationBackend backend() {
        return services.generationBackends().forModel(engine.getTenantId(), param.getLlmId());
    }

    /**
     * Calls the backend and waits for the answer.
     *
     * @throws BackendFailureException if the backend fails
     */
    @NotNull
    protected String call(@NotNull GenerationBackend backend, @NotNull FittedPrompt fitted,
                          @NotNull Map<String, Object> conf) {
        try {
            String answer = backend.chat(fitted.systemPrompt(), fitted.messages(), conf).join();
            return answer != null ? answer : "";
        } catch (RuntimeException e) {
            throw generationFailure(e);
        }
    }

    /**
     * Unwraps {@link CompletionException} and wraps anything that is not already a backend failure.
     */
    @NotNull
    protected BackendFailureException generationFailure(@NotNull RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof BackendFailureException failure) {
            return failure;
        }
        return new BackendFailureException("Generation failed for " + id + ": " + cause.getMessage(), cause);
    }

    @NotNull
    protected static String stripReasoning(@NotNull String answer) {
        return THINK_BLOCK.matcher(answer).replaceFirst("");
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private String renderPrompt(Map<String, String> vars) {
        String prompt = PromptTemplate.substitute(param.getPrompt(), vars);
        if (prompt.contains(PromptTemplate.INPUT_PLACEHOLDER) && !vars.containsKey("input")) {
            String input = PromptTemplate.bullets(getInput().contents());
            prompt = prompt.replace(PromptTemplate.INPUT_PLACEHOLDER, input);
        }
        return prompt;
    }

    private boolean streamsToAnswer(Map<String, Object> kwargs) {
        if (!streamRequested(kwargs)) {
            return false;
        }
        List<String> downstream = engine.getDownstream(id);
        return downstream.size() == 1 && ComponentTypes.isAnswer(engine.getComponentName(downstream.get(0)));
    }

    private static String emptyResponse(ComponentResult retrieval, String fallback) {
        ResultRow first = retrieval.first();
        if (first != null && first.emptyResponse() != null && !first.emptyResponse().isBlank()) {
            return first.emptyResponse();
        }
        return fallback;
    }

    private ResultRow finish(ComponentResult retrieval, String answer) {
        ResultRow first = retrieval.first();
        if (param.isCite() && first != null && first.hasChunks()) {
            return citationAssembler.cite(retrieval, answer,
                new EmbeddingModelRef(engine.getTenantId(), engine.getEmbeddingModel()));
        }
        return ResultRow.of(answer);
    }

    /**
     * Pulls partial answers from the backend and ends with the final row.
     * Nothing is sent to the backend before the first pull.
     */
    private final class GenerationStream implements Iterator<StreamEvent> {

        private final String prompt;
        private final ComponentResult retrieval;
        private final Deque<StreamEvent> pending = new ArrayDeque<>();

        private boolean started;
        private boolean finished;
        @Nullable
        private Iterator<String> increments;
        @Nullable
        private FittedPrompt fitted;
        private String answer = "";

        GenerationStream(String prompt, ComponentResult retrieval) {
            this.prompt = prompt;
            this.retrieval = retrieval;
        }

        @Override
        public boolean hasNext() {
            if (!started) {
                start();
            }
            if (!pending.isEmpty()) {
                return true;
            }
            if (finished) {
                return false;
            }
            if (pullIncrement()) {
                pending.add(new StreamEvent.Partial(answer != null ? answer : ""));
                return true;
            }
            complete();
            return !pending.isEmpty();
        }

        @Override
        public StreamEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void start() {
            started = true;
            if (!retrieval.hasRetrievedContent()) {
                String message = emptyResponse(retrieval, services.settings().emptyStreamResponse());
                logger.info("Retrieval result is empty for {}, streaming: '{}'", id, message);
                pending.add(new StreamEvent.Final(message, Reference.empty()));
                finished = true;
                return;
            }
            GenerationBackend backend = backend();
            fitted = promptBuilder.build(
                prompt, engine.getHistory(param.getMessageHistoryWindowSize()), backend.maxLength(), backend.lengthUnit());
            try {
                increments = backend.chatStreaming(fitted.systemPrompt(), fitted.messages(), param.genConf());
            } catch (RuntimeException e) {
                finished = true;
                throw generationFailure(e);
            }
        }

        private boolean pullIncrement() {
            if (increments == null) {
                return false;
            }
            try {
                if (!increments.hasNext()) {
                    return false;
                }
                answer = increments.next();
                return true;
            } catch (RuntimeException e) {
                finished = true;
                throw generationFailure(e);
            }
        }

        private void complete() {
            finished = true;
            if (fitted != null) {
                engine.setComponentInfo(id, new ComponentInfo(fitted.systemPrompt(), fitted.messages(), param.genConf()));
            }
            pending.add(StreamEvent.Final.of(finish(retrieval, stripReasoning(answer != null ? answer : ""))));
        }
    }
}

package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.exception.BackendFailureException;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.llm.LengthUnit;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Generation backend over an OpenAI-compatible chat completion endpoint.
 * Settings a stage leaves out fall back to the configured defaults.
 */
public class RestChatBackend implements GenerationBackend {

    private static final Logger LOG = Logger.getLogger(RestChatBackend.class);

    /**
     * Defaults applied when a stage does not set a value.
     */
    public record ChatDefaults(
        @Nullable Double temperature,
        @Nullable Integer maxTokens,
        @Nullable Double topP
    ) {}

    private final LlmChatClient client;
    private final String model;
    private final ChatDefaults defaults;
    private final int maxLength;
    private final LengthUnit lengthUnit;
    private final Executor executor;

    public RestChatBackend(@NotNull LlmChatClient client, @NotNull String model, @NotNull ChatDefaults defaults,
                           int maxLength, @NotNull LengthUnit lengthUnit, @NotNull Executor executor) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.maxLength = maxLength;
        this.lengthUnit = Objects.requireNonNull(lengthUnit, "lengthUnit must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public CompletableFuture<String> chat(
            @Nullable final String systemPrompt,
            @NotNull final List<ChatMessage> messages,
            @NotNull final Map<String, Object> config) {

        return CompletableFuture.supplyAsync(() -> {
            final LlmChatRequest request = buildRequest(systemPrompt, messages, config);
            LOG.debugf("Calling LLM with model: %s, messages: %d, thread: %s",
                model, Integer.valueOf(request.messages().size()), Thread.currentThread().getName());

            final LlmChatResponse response = client.chat(request);
            if (response == null || response.choices() == null || response.choices().isEmpty()) {
                throw new BackendFailureException("LLM returned no choices in response");
            }
            final LlmChatMessage message = response.choices().get(0).message();
            final String content = message != null && message.content() != null ? message.content() : "";

            final String tokenInfo = response.usage() != null ? String.valueOf(response.usage().totalTokens()) : "unknown";
            LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                Integer.valueOf(content.length()), tokenInfo);
            return content;
        }, executor);
    }

    @Override
    public int maxLength() {
        return maxLength;
    }

    @Override
    public LengthUnit lengthUnit() {
        return lengthUnit;
    }

    @NotNull
    public String model() {
        return model;
    }

    /**
     * Message order: [system], chat turns.
     */
    LlmChatRequest buildRequest(@Nullable String systemPrompt, List<ChatMessage> messages, Map<String, Object> config) {
        final List<LlmChatMessage> wire = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            wire.add(new LlmChatMessage(ChatMessage.Role.SYSTEM.wireName(), systemPrompt));
        }
        for (final ChatMessage message : messages) {
            wire.add(LlmChatMessage.from(message));
        }

        return new LlmChatRequest(
            model,
            wire,
            false,
            getIntegerParam(config, "max_tokens", defaults.maxTokens()),
            getDoubleParam(config, "temperature", defaults.temperature()),
            getDoubleParam(config, "top_p", defaults.topP()),
            getDoubleParam(config, "presence_penalty", null),
            getDoubleParam(config, "frequency_penalty", null)
        );
    }

    private static Double getDoubleParam(final Map<String, Object> config, final String key, final Double defaultValue) {
        final Object value = config.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return defaultValue;
    }

    private static Integer getIntegerParam(final Map<String, Object> config, final String key, final Integer defaultValue) {
        final Object value = config.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }
}

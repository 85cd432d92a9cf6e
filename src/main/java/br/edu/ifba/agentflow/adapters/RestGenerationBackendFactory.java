package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.config.AgentFlowConfig;
import br.edu.ifba.agentflow.config.AgentFlowProducer;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.llm.GenerationBackendFactory;
import br.edu.ifba.agentflow.llm.LengthUnit;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Resolves a stage's {@code llm_id} to a backend on the configured chat completion endpoint.
 *
 * <p>Model ids may carry a provider suffix ({@code gpt-4o@OpenAI}); only the part before
 * {@code @} is sent. A blank id falls back to {@code chat.model}.</p>
 */
@ApplicationScoped
public class RestGenerationBackendFactory implements GenerationBackendFactory {

    private static final Logger LOG = Logger.getLogger(RestGenerationBackendFactory.class);

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    AgentFlowConfig config;

    @Inject
    @Named(AgentFlowProducer.EXECUTOR)
    ExecutorService executor;

    @ConfigProperty(name = "chat.model")
    String defaultModel;

    @ConfigProperty(name = "chat.temperature", defaultValue = "0.7")
    Double defaultTemperature;

    @ConfigProperty(name = "chat.max.tokens", defaultValue = "2048")
    Integer defaultMaxTokens;

    @ConfigProperty(name = "chat.top.p", defaultValue = "0.9")
    Double defaultTopP;

    private final Map<String, GenerationBackend> backends = new ConcurrentHashMap<>();

    @Override
    @NotNull
    public GenerationBackend forModel(@NotNull String tenantId, @NotNull String llmId) {
        String model = modelName(llmId, defaultModel);
        return backends.computeIfAbsent(model, name -> {
            LOG.infof("Creating chat backend for model %s (tenant %s)", name, tenantId);
            return new RestChatBackend(
                chatClient,
                name,
                new RestChatBackend.ChatDefaults(defaultTemperature, defaultMaxTokens, defaultTopP),
                config.generation().maxLength(),
                LengthUnit.fromString(config.generation().lengthUnit()),
                executor);
        });
    }

    static String modelName(String llmId, String defaultModel) {
        if (llmId == null || llmId.isBlank()) {
            return defaultModel;
        }
        int at = llmId.indexOf('@');
        return at >= 0 ? llmId.substring(0, at) : llmId;
    }
}

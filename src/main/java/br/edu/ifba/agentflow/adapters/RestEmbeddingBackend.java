package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.config.AgentFlowProducer;
import br.edu.ifba.agentflow.exception.BackendFailureException;
import br.edu.ifba.agentflow.llm.EmbeddingBackend;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Embedding backend over the configured {@code llm-embedding} endpoint.
 * A blank model id falls back to {@code embedding.model}.
 */
@ApplicationScoped
public class RestEmbeddingBackend implements EmbeddingBackend {

    private static final Logger LOG = Logger.getLogger(RestEmbeddingBackend.class);

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @Inject
    @Named(AgentFlowProducer.EXECUTOR)
    ExecutorService executor;

    @ConfigProperty(name = "embedding.model")
    String defaultModel;

    @Override
    public CompletableFuture<List<float[]>> embed(@Nullable String modelId, @NotNull List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String model = RestGenerationBackendFactory.modelName(modelId, defaultModel);

        return CompletableFuture.supplyAsync(() -> {
            LOG.debugf("Embedding request - model: %s, texts: %d, thread: %s",
                model, Integer.valueOf(texts.size()), Thread.currentThread().getName());

            LlmEmbeddingResponse response = embeddingClient.embed(new LlmEmbeddingRequest(model, texts));
            if (response == null || response.data() == null || response.data().isEmpty()) {
                throw new BackendFailureException("Embedding API returned no data");
            }
            if (response.data().size() != texts.size()) {
                throw new BackendFailureException(String.format(
                    "Expected %d embeddings but received %d", texts.size(), response.data().size()));
            }
            return toVectors(response.data());
        }, executor);
    }

    static List<float[]> toVectors(List<LlmEmbeddingResponse.Embedding> data) {
        List<LlmEmbeddingResponse.Embedding> ordered = new ArrayList<>(data);
        ordered.sort(Comparator.comparing((LlmEmbeddingResponse.Embedding e) -> e.index() != null ? e.index() : Integer.MAX_VALUE));

        List<float[]> vectors = new ArrayList<>(ordered.size());
        for (LlmEmbeddingResponse.Embedding item : ordered) {
            List<Double> values = item.embedding();
            if (values == null || values.isEmpty()) {
                throw new BackendFailureException("Embedding API returned null or empty vector");
            }
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                Double value = values.get(i);
                vector[i] = value != null ? value.floatValue() : 0f;
            }
            vectors.add(vector);
        }
        return vectors;
    }
}

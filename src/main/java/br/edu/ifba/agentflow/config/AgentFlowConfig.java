package br.edu.ifba.agentflow.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Tunables of the workflow stages.
 *
 * <p>Loaded from application.properties with the "agentflow" prefix.
 *
 * <p>Example configuration:
 * <pre>
 * agentflow.generation.budget-ratio=0.97
 * agentflow.generation.max-length=8192
 * agentflow.generation.length-unit=tokens
 * agentflow.retrieval.max-rendered-length=200000
 * agentflow.citation.threshold=0.2
 * </pre>
 */
@ConfigMapping(prefix = "agentflow")
public interface AgentFlowConfig {

    /**
     * Prompt assembly and generation settings.
     *
     * @return generation configuration
     */
    Generation generation();

    /**
     * Retrieval stage settings.
     *
     * @return retrieval configuration
     */
    Retrieval retrieval();

    /**
     * Relevance grader settings.
     *
     * @return relevance configuration
     */
    Relevance relevance();

    /**
     * Citation settings.
     *
     * @return citation configuration
     */
    Citation citation();

    interface Generation {

        /**
         * Share of the backend context window a prompt may fill.
         *
         * @return ratio in (0, 1]
         */
        @WithName("budget-ratio")
        @WithDefault("0.97")
        double budgetRatio();

        /**
         * User turn synthesized when fitting leaves no chat message.
         *
         * @return default user turn
         */
        @WithName("default-user-turn")
        @WithDefault("Output: ")
        String defaultUserTurn();

        @WithName("empty-response")
        @WithDefault("Nothing found in knowledgebase (mock response).")
        String emptyResponse();

        @WithName("empty-stream-response")
        @WithDefault("Nothing found in knowledgebase (mock stream response).")
        String emptyStreamResponse();

        /**
         * Context window reported by the REST chat backend.
         *
         * @return maximum length in {@link #lengthUnit()}
         */
        @WithName("max-length")
        @WithDefault("4096")
        int maxLength();

        /**
         * How the context window is measured.
         *
         * @return "tokens" or "characters"
         */
        @WithName("length-unit")
        @WithDefault("tokens")
        String lengthUnit();
    }

    interface Retrieval {

        /**
         * Cap for the knowledge block rendered by the retrieval stage.
         *
         * @return maximum characters before truncation
         */
        @WithName("max-rendered-length")
        @WithDefault("200000")
        int maxRenderedLength();
    }

    interface Relevance {

        @WithName("chars-per-token")
        @WithDefault("4")
        int charsPerToken();

        @WithName("reserved-chars")
        @WithDefault("20")
        int reservedChars();
    }

    interface Citation {

        @WithName("keyword-weight")
        @WithDefault("0.7")
        double keywordWeight();

        @WithName("vector-weight")
        @WithDefault("0.3")
        double vectorWeight();

        /**
         * Minimum similarity for a sentence to cite a chunk.
         *
         * @return threshold (0.0 - 1.0)
         */
        @WithDefault("0.2")
        double threshold();
    }

    /**
     * Checks that ratios and weights are in range.
     *
     * @return true if the configuration is valid
     */
    default boolean isValid() {
        return generation().budgetRatio() > 0 && generation().budgetRatio() <= 1
            && generation().maxLength() > 0
            && retrieval().maxRenderedLength() > 0
            && relevance().charsPerToken() > 0
            && relevance().reservedChars() >= 0
            && citation().keywordWeight() >= 0
            && citation().vectorWeight() >= 0
            && citation().threshold() >= 0 && citation().threshold() <= 1;
    }

    /**
     * Gets a human-readable description of the current configuration.
     *
     * @return configuration description
     */
    default String describe() {
        return String.format("budget-ratio=%s, max-length=%d %s, max-rendered-length=%d, citation threshold=%s",
            generation().budgetRatio(), generation().maxLength(), generation().lengthUnit(),
            retrieval().maxRenderedLength(), citation().threshold());
    }
}

package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.config.AgentFlowConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Tunables shared by all stages.
 *
 * @param budgetRatio share of the backend context window a prompt may fill
 * @param defaultUserTurn user turn synthesized when fitting leaves no chat message
 * @param emptyResponse reply when retrieval found nothing
 * @param emptyStreamResponse same, on the streaming path
 * @param maxRenderedLength cap for the rendered knowledge block
 * @param relevanceCharsPerToken characters assumed per token by the relevance grader
 * @param relevanceReservedChars characters kept free by the relevance grader
 * @param citationKeywordWeight keyword weight passed to the citation backend
 * @param citationVectorWeight vector weight passed to the citation backend
 */
public record ComponentSettings(
    double budgetRatio,
    @NotNull String defaultUserTurn,
    @NotNull String emptyResponse,
    @NotNull String emptyStreamResponse,
    int maxRenderedLength,
    int relevanceCharsPerToken,
    int relevanceReservedChars,
    double citationKeywordWeight,
    double citationVectorWeight
) {

    public static final double DEFAULT_BUDGET_RATIO = 0.97;
    public static final String DEFAULT_USER_TURN = "Output: ";
    public static final String DEFAULT_EMPTY_RESPONSE = "Nothing found in knowledgebase (mock response).";
    public static final String DEFAULT_EMPTY_STREAM_RESPONSE = "Nothing found in knowledgebase (mock stream response).";
    public static final int DEFAULT_MAX_RENDERED_LENGTH = 200000;

    public static ComponentSettings defaults() {
        return new ComponentSettings(
            DEFAULT_BUDGET_RATIO,
            DEFAULT_USER_TURN,
            DEFAULT_EMPTY_RESPONSE,
            DEFAULT_EMPTY_STREAM_RESPONSE,
            DEFAULT_MAX_RENDERED_LENGTH,
            4,
            20,
            0.7,
            0.3
        );
    }

    public static ComponentSettings from(@NotNull AgentFlowConfig config) {
        return new ComponentSettings(
            config.generation().budgetRatio(),
            config.generation().defaultUserTurn(),
            config.generation().emptyResponse(),
            config.generation().emptyStreamResponse(),
            config.retrieval().maxRenderedLength(),
            config.relevance().charsPerToken(),
            config.relevance().reservedChars(),
            config.citation().keywordWeight(),
            config.citation().vectorWeight()
        );
    }
}

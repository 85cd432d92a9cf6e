package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentParam;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the retrieval stage.
 */
public class RetrievalParam extends ComponentParam {

    @JsonProperty("similarity_threshold")
    private double similarityThreshold = 0.2;

    @JsonProperty("keywords_similarity_weight")
    private double keywordsSimilarityWeight = 0.5;

    @JsonProperty("top_n")
    private int topN = 8;

    @JsonProperty("top_k")
    private int topK = 1024;

    @JsonProperty("kb_ids")
    private List<String> kbIds = new ArrayList<>();

    @JsonProperty("kb_vars")
    private List<Object> kbVars = new ArrayList<>();

    @JsonProperty("rerank_id")
    private String rerankId = "";

    @JsonProperty("empty_response")
    private String emptyResponse = "";

    @JsonProperty("tavily_api_key")
    private String tavilyApiKey = "";

    @JsonProperty("use_kg")
    private boolean useKg = false;

    @Override
    public void check() {
        checkDecimalFloat(similarityThreshold, "[Retrieval] Similarity threshold");
        checkDecimalFloat(keywordsSimilarityWeight, "[Retrieval] Keyword similarity weight");
        checkPositiveNumber(topN, "[Retrieval] Top N");
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public double getKeywordsSimilarityWeight() {
        return keywordsSimilarityWeight;
    }

    public int getTopN() {
        return topN;
    }

    public int getTopK() {
        return topK;
    }

    @NotNull
    public List<String> getKbIds() {
        return kbIds != null ? kbIds : List.of();
    }

    @NotNull
    public List<Object> getKbVars() {
        return kbVars != null ? kbVars : List.of();
    }

    /**
     * @return the configured empty response, or null when blank
     */
    @Nullable
    public String getEmptyResponse() {
        return emptyResponse != null && !emptyResponse.isBlank() ? emptyResponse : null;
    }

    @NotNull
    public String getTavilyApiKey() {
        return tavilyApiKey != null ? tavilyApiKey : "";
    }

    public boolean isUseKg() {
        return useKg;
    }
}

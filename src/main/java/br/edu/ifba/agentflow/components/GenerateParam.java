package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentParam;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a generating stage.
 */
public class GenerateParam extends ComponentParam {

    @JsonProperty("llm_id")
    protected String llmId = "";

    protected String prompt = "";

    @JsonProperty("max_tokens")
    protected int maxTokens = 0;

    protected double temperature = 0;

    @JsonProperty("top_p")
    protected double topP = 0;

    @JsonProperty("presence_penalty")
    protected double presencePenalty = 0;

    @JsonProperty("frequency_penalty")
    protected double frequencyPenalty = 0;

    protected boolean cite = true;

    public GenerateParam() {
        this.messageHistoryWindowSize = 12;
    }

    /**
     * @return prefix used in validation messages, e.g. {@code [Generate]}
     */
    protected String label() {
        return "[Generate]";
    }

    @Override
    public void check() {
        checkDecimalFloat(temperature, label() + " Temperature");
        checkDecimalFloat(presencePenalty, label() + " Presence penalty");
        checkDecimalFloat(frequencyPenalty, label() + " Frequency penalty");
        checkNonNegativeNumber(maxTokens, label() + " Max tokens");
        checkDecimalFloat(topP, label() + " Top P");
        checkEmpty(llmId, label() + " LLM id");
    }

    /**
     * Generation settings passed to the backend. Only positive values are included.
     */
    @NotNull
    public Map<String, Object> genConf() {
        Map<String, Object> conf = new LinkedHashMap<>();
        if (maxTokens > 0) {
            conf.put("max_tokens", maxTokens);
        }
        if (temperature > 0) {
            conf.put("temperature", temperature);
        }
        if (topP > 0) {
            conf.put("top_p", topP);
        }
        if (presencePenalty > 0) {
            conf.put("presence_penalty", presencePenalty);
        }
        if (frequencyPenalty > 0) {
            conf.put("frequency_penalty", frequencyPenalty);
        }
        return conf;
    }

    @NotNull
    public String getLlmId() {
        return llmId != null ? llmId : "";
    }

    @NotNull
    public String getPrompt() {
        return prompt != null ? prompt : "";
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public boolean isCite() {
        return cite;
    }
}

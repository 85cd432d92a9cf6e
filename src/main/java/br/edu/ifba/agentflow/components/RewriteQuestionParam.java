package br.edu.ifba.agentflow.components;

import org.jetbrains.annotations.NotNull;

/**
 * Parameters of the question rewrite stage.
 */
public class RewriteQuestionParam extends GenerateParam {

    private String language = "";

    public RewriteQuestionParam() {
        this.temperature = 0.9;
    }

    @Override
    protected String label() {
        return "[RewriteQuestion]";
    }

    @NotNull
    public String getLanguage() {
        return language != null ? language : "";
    }
}

package br.edu.ifba.agentflow.components;

import org.jetbrains.annotations.NotNull;

/**
 * Grader parameters: the outputs to emit for a relevant and an irrelevant upstream.
 */
public class RelevantParam extends GenerateParam {

    static final String GRADER_PROMPT = """
        You are a grader assessing relevance of a retrieved document to a user question.
        It does not need to be a stringent test. The goal is to filter out erroneous retrievals.
        If the document contains keyword(s) or semantic meaning related to the user question, grade it as relevant.
        Give a binary score 'yes' or 'no' score to indicate whether the document is relevant to the question.
        No other words needed except 'yes' or 'no'.
        """;

    private String yes = "";

    private String no = "";

    @Override
    protected String label() {
        return "[Relevant]";
    }

    @Override
    public void check() {
        super.check();
        checkEmpty(yes, "[Relevant] 'Yes'");
        checkEmpty(no, "[Relevant] 'No'");
    }

    /**
     * The grader prompt is fixed; a configured prompt is ignored.
     */
    @Override
    @NotNull
    public String getPrompt() {
        return GRADER_PROMPT;
    }

    @NotNull
    public String getYes() {
        return yes != null ? yes : "";
    }

    @NotNull
    public String getNo() {
        return no != null ? no : "";
    }
}

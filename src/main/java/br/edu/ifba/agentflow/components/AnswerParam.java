package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentParam;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class AnswerParam extends ComponentParam {

    @JsonProperty("post_answers")
    private List<String> postAnswers = new ArrayList<>();

    @Override
    public void check() {
        // Nothing to validate
    }

    @NotNull
    public List<String> getPostAnswers() {
        return postAnswers != null ? postAnswers : List.of();
    }
}

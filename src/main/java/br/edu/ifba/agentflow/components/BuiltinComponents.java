package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentRegistry;
import br.edu.ifba.agentflow.component.ComponentTypes;

/**
 * Registry of the built-in stage types.
 */
public final class BuiltinComponents {

    private BuiltinComponents() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return a new registry with every built-in type; callers may register more
     */
    public static ComponentRegistry registry() {
        return new ComponentRegistry()
            .register(ComponentTypes.BEGIN, BeginParam::new, BeginComponent::new)
            .register(ComponentTypes.ANSWER, AnswerParam::new, AnswerComponent::new)
            .register(ComponentTypes.GENERATE, GenerateParam::new, GenerateComponent<GenerateParam>::new)
            .register(ComponentTypes.RETRIEVAL, RetrievalParam::new, RetrievalComponent::new)
            .register(ComponentTypes.RELEVANT, RelevantParam::new, RelevantComponent::new)
            .register(ComponentTypes.REWRITE_QUESTION, RewriteQuestionParam::new, RewriteQuestionComponent::new)
            .register(ComponentTypes.EXE_SQL, ExeSqlParam::new, ExeSqlComponent::new);
    }
}

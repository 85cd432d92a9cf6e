package br.edu.ifba.agentflow.component;

/**
 * Names of the built-in component types as they appear in workflow documents.
 */
public final class ComponentTypes {

    public static final String BEGIN = "Begin";
    public static final String ANSWER = "Answer";
    public static final String GENERATE = "Generate";
    public static final String RETRIEVAL = "Retrieval";
    public static final String RELEVANT = "Relevant";
    public static final String REWRITE_QUESTION = "RewriteQuestion";
    public static final String EXE_SQL = "ExeSQL";

    private ComponentTypes() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isAnswer(String componentName) {
        return ANSWER.equalsIgnoreCase(componentName);
    }

    public static boolean isRetrieval(String componentName) {
        return RETRIEVAL.equalsIgnoreCase(componentName);
    }
}

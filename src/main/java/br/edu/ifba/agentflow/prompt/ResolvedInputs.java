package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.component.ComponentResult;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values resolved for the placeholders of one prompt.
 *
 * @param values placeholder key to substituted text, in resolution order
 * @param retrievalResults outputs of the referenced retrieval stages, kept for citation
 * @param inputLog per-key record of what was resolved, for diagnostics
 */
public record ResolvedInputs(
    @NotNull Map<String, String> values,
    @NotNull List<ComponentResult> retrievalResults,
    @NotNull List<Map<String, Object>> inputLog
) {
    public ResolvedInputs {
        values = new LinkedHashMap<>(values);
        retrievalResults = List.copyOf(retrievalResults);
        inputLog = List.copyOf(inputLog);
    }

    /**
     * @return all retrieval rows, in reference order
     */
    @NotNull
    public ComponentResult mergedRetrieval() {
        return ComponentResult.concat(retrievalResults);
    }
}

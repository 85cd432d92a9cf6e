package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL stage with database access disabled. It still extracts the statement from the upstream text
 * and reports whether that worked; the statement is never executed.
 */
public class ExeSqlComponent extends GenerateComponent<ExeSqlParam> {

    private static final Logger logger = LoggerFactory.getLogger(ExeSqlComponent.class);

    private static final Pattern SQL_FENCE = Pattern.compile("```sql\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern LEADING_TEXT = Pattern.compile("^.*?SELECT ", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern TEXT_BETWEEN = Pattern.compile(";.*?SELECT ", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_TEXT = Pattern.compile(";[^;]*$");
    private static final Pattern SELECT = Pattern.compile("SELECT ", Pattern.CASE_INSENSITIVE);

    public ExeSqlComponent(String id, ExeSqlParam param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.EXE_SQL;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        String input = String.join("", getInput().contents());
        logger.info("SQL stage {} targets {} database '{}' at {}:{} (loop {}, top {}), database access is disabled",
            id, param.getDbType(), param.getDatabase(), param.getHost(), param.getPort(), param.getLoop(), param.getTopN());

        String sql;
        try {
            sql = extractSql(input);
        } catch (IllegalArgumentException e) {
            logger.warn("Could not extract SQL from input: {}", e.getMessage());
            return StageOutput.settled(beOutput("Error processing SQL input or component disabled: " + e.getMessage()));
        }

        logger.debug("Extracted SQL (not executed): {}", sql);
        return StageOutput.settled(beOutput(String.format(
            "ExeSQL component is configured for '%s' but is non-functional as database access is disabled "
                + "in this environment. Received SQL (not executed): %s", param.getDbType(), sql)));
    }

    @Override
    @NotNull
    public ComponentResult debug(@NotNull Map<String, Object> inputs) {
        return ((StageOutput.Settled) execute(List.of(), inputs)).result();
    }

    /**
     * Pulls a SQL statement out of free text. A fenced {@code sql} block wins; otherwise the text
     * is sliced from the first {@code SELECT} and cut after the last {@code ;}.
     *
     * @throws IllegalArgumentException if no statement is found
     */
    @NotNull
    public static String extractSql(@NotNull String text) {
        String answer = stripReasoning(text);

        Matcher fenced = SQL_FENCE.matcher(answer);
        if (fenced.find()) {
            return fenced.group(1);
        }

        if (!SELECT.matcher(answer).find()) {
            throw new IllegalArgumentException("SQL statement not found!");
        }
        answer = LEADING_TEXT.matcher(answer).replaceFirst("SELECT ");
        answer = TEXT_BETWEEN.matcher(answer).replaceAll("; SELECT ");
        answer = TRAILING_TEXT.matcher(answer).replaceFirst(";");
        if (answer.isBlank()) {
            throw new IllegalArgumentException("SQL statement not found!");
        }
        return answer;
    }
}

package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentServices;
import br.edu.ifba.agentflow.component.ComponentTypes;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.retrieval.ChunkSanitizer;
import br.edu.ifba.agentflow.retrieval.KnowledgePrompt;
import br.edu.ifba.agentflow.retrieval.Reference;
import br.edu.ifba.agentflow.retrieval.RetrievalChunk;
import br.edu.ifba.agentflow.retrieval.RetrievalResultSet;
import br.edu.ifba.agentflow.retrieval.RetrievalSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Fans in chunks from the graph-augmented source and the web search source.
 *
 * <p>Enabled sources are queried concurrently and merged in a fixed order: graph source first,
 * then web search. A failing source contributes nothing; it never fails the stage.</p>
 */
public class RetrievalComponent extends Component<RetrievalParam> {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalComponent.class);

    private static final Pattern ROLE_MARKER = Pattern.compile("(USER:|ASSISTANT:)");
    private static final Pattern USER_PREFIX = Pattern.compile("^user[:：\\s]*", Pattern.CASE_INSENSITIVE);

    public RetrievalComponent(String id, RetrievalParam param, WorkflowEngine engine, ComponentServices services) {
        super(id, param, engine, services);
    }

    @Override
    @NotNull
    public String getComponentName() {
        return ComponentTypes.RETRIEVAL;
    }

    @Override
    @NotNull
    protected StageOutput execute(@NotNull List<ChatMessage> history, @NotNull Map<String, Object> kwargs) {
        ResultRow first = getInput().first();
        String query = extractQuery(first != null ? first.content() : "");

        if (!param.getKbIds().isEmpty() || !param.getKbVars().isEmpty()) {
            logger.warn("Retrieval {}: kb_ids/kb_vars are set but no knowledge base backend is available, ignoring them", id);
        }

        List<CompletableFuture<RetrievalResultSet>> pending = new ArrayList<>();
        if (param.isUseKg()) {
            pending.add(fetch("graph", services.graphSource(), query));
        }
        if (!param.getTavilyApiKey().isBlank()) {
            pending.add(fetch("web search", services.webSearchSources().forApiKey(param.getTavilyApiKey()), query));
        } else {
            logger.debug("Retrieval {}: no web search API key, skipping web search", id);
        }

        List<RetrievalResultSet> parts = new ArrayList<>();
        for (CompletableFuture<RetrievalResultSet> future : pending) {
            parts.add(future.join());
        }
        RetrievalResultSet merged = RetrievalResultSet.merge(parts);

        if (merged.isEmpty()) {
            String emptyResponse = param.getEmptyResponse();
            logger.info("Retrieval {}: no chunks found from any source", id);
            return StageOutput.settled(ComponentResult.of(new ResultRow(
                emptyResponse != null ? emptyResponse : "", Reference.empty(), null, emptyResponse)));
        }

        List<Map<String, Object>> serializable = new ArrayList<>();
        List<RetrievalChunk> chunks = new ArrayList<>();
        for (RetrievalChunk chunk : merged.chunks()) {
            Map<String, Object> fields = ChunkSanitizer.serializable(chunk.fields());
            serializable.add(fields);
            chunks.add(new RetrievalChunk(fields));
        }

        String content = KnowledgePrompt.render(chunks, services.settings().maxRenderedLength());
        logger.debug("Retrieval {} for '{}' produced {} chunks", id, query, chunks.size());
        return StageOutput.settled(ComponentResult.of(
            new ResultRow(content, Reference.empty(), serialize(serializable), null)));
    }

    /**
     * Takes the text after the last role marker and drops a leading {@code user:} prefix.
     */
    @NotNull
    static String extractQuery(@NotNull String input) {
        String[] segments = ROLE_MARKER.split(input, -1);
        String query = segments.length > 0 ? segments[segments.length - 1] : "";
        return USER_PREFIX.matcher(query).replaceFirst("");
    }

    private CompletableFuture<RetrievalResultSet> fetch(String sourceName, RetrievalSource source, String query) {
        return CompletableFuture
            .supplyAsync(() -> source.retrieve(query, param.getTopN()), services.retrievalExecutor())
            .exceptionally(e -> {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("Retrieval {}: {} source failed, continuing without it: {}", id, sourceName, cause.getMessage());
                return RetrievalResultSet.empty();
            });
    }

    private String serialize(List<Map<String, Object>> chunks) {
        try {
            return services.objectMapper().writeValueAsString(chunks);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Retrieved chunks could not be serialized: " + e.getOriginalMessage(), e);
        }
    }
}

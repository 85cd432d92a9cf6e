package br.edu.ifba.agentflow.citation;

import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ComponentSettings;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.exception.CitationDataException;
import br.edu.ifba.agentflow.retrieval.ChunkSanitizer;
import br.edu.ifba.agentflow.retrieval.DocAggregate;
import br.edu.ifba.agentflow.retrieval.Reference;
import br.edu.ifba.agentflow.retrieval.RetrievalChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Attaches citations to a generated answer.
 *
 * <p>Citation is best effort: a missing or undecodable chunk payload, or a failing backend,
 * yields the answer unchanged with an empty reference.</p>
 */
public class CitationAssembler {

    private static final Logger logger = LoggerFactory.getLogger(CitationAssembler.class);

    static final String CREDENTIAL_HINT = " Please set LLM API-Key in 'User Setting -> Model providers -> API-Key'";

    private static final TypeReference<List<Map<String, Object>>> CHUNK_LIST = new TypeReference<>() {};

    private final CitationBackend backend;
    private final ObjectMapper objectMapper;
    private final double keywordWeight;
    private final double vectorWeight;

    public CitationAssembler(@NotNull CitationBackend backend, @NotNull ObjectMapper objectMapper,
                             @NotNull ComponentSettings settings) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.keywordWeight = settings.citationKeywordWeight();
        this.vectorWeight = settings.citationVectorWeight();
    }

    /**
     * @param retrieval retrieval rows; the chunk payload of the first row is used
     * @param answer raw answer
     * @param embeddingModel embedding model of the conversation
     * @return one row with the (possibly annotated) answer and its reference
     */
    @NotNull
    public ResultRow cite(@NotNull ComponentResult retrieval, @NotNull String answer,
                          @NotNull EmbeddingModelRef embeddingModel) {
        ResultRow first = retrieval.first();
        if (first == null || !first.hasChunks()) {
            logger.warn("No chunk payload available for citation");
            return uncited(answer);
        }

        List<RetrievalChunk> chunks;
        try {
            chunks = decodeChunks(first.chunks());
        } catch (CitationDataException e) {
            logger.warn("Citation skipped: {}", e.getMessage());
            return uncited(answer);
        }
        if (chunks.isEmpty()) {
            logger.warn("Chunk payload is empty, citation skipped");
            return uncited(answer);
        }

        List<String> contents = new ArrayList<>();
        List<List<Double>> vectors = new ArrayList<>();
        for (RetrievalChunk chunk : chunks) {
            contents.add(chunk.content() != null ? chunk.content() : "");
            vectors.add(chunk.vector());
        }

        CitationResult result;
        try {
            result = backend.insertCitations(answer, contents, vectors, embeddingModel, keywordWeight, vectorWeight);
        } catch (RuntimeException e) {
            logger.warn("Citation backend failed, returning uncited answer: {}", e.getMessage());
            return uncited(answer);
        }

        List<DocAggregate> docAggs = aggregate(chunks, result.usedIndices());

        List<Map<String, Object>> sanitized = new ArrayList<>();
        for (RetrievalChunk chunk : chunks) {
            sanitized.add(ChunkSanitizer.forReference(chunk.fields()));
        }

        String content = result.answer();
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.contains("invalid key") || lower.contains("invalid api")) {
            content += CREDENTIAL_HINT;
        }

        logger.debug("Citation used {} chunks from {} documents", result.usedIndices().size(), docAggs.size());
        return new ResultRow(content, new Reference(sanitized, docAggs));
    }

    /**
     * Walks the used indices in order and keeps the first chunk of each document.
     * Out-of-range indices are ignored.
     */
    @NotNull
    static List<DocAggregate> aggregate(@NotNull List<RetrievalChunk> chunks, @NotNull List<Integer> usedIndices) {
        Set<String> seen = new HashSet<>();
        List<DocAggregate> aggs = new ArrayList<>();
        for (Integer index : usedIndices) {
            if (index == null || index < 0 || index >= chunks.size()) {
                continue;
            }
            RetrievalChunk chunk = chunks.get(index);
            String docId = chunk.docId() != null ? chunk.docId() : "unknown_doc_" + index;
            if (!seen.add(docId)) {
                continue;
            }
            String docName = chunk.docName() != null ? chunk.docName() : "Unknown Document " + index;
            aggs.add(new DocAggregate(docId, docName));
        }
        return aggs;
    }

    private List<RetrievalChunk> decodeChunks(String payload) {
        List<Map<String, Object>> decoded;
        try {
            decoded = objectMapper.readValue(payload, CHUNK_LIST);
        } catch (JsonProcessingException e) {
            throw new CitationDataException("chunk payload is not a JSON list of objects: " + e.getOriginalMessage(), e);
        }
        if (decoded == null) {
            return List.of();
        }
        List<RetrievalChunk> chunks = new ArrayList<>();
        for (Map<String, Object> fields : decoded) {
            if (fields != null) {
                chunks.add(new RetrievalChunk(fields));
            }
        }
        return chunks;
    }

    private static ResultRow uncited(String answer) {
        return new ResultRow(answer, Reference.empty());
    }
}

package br.edu.ifba.agentflow.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * JSON (de)serialization of {@link WorkflowDocument}.
 */
public class WorkflowDocumentCodec {

    private final ObjectMapper objectMapper;

    public WorkflowDocumentCodec(@NotNull ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @NotNull
    public String toJson(@NotNull WorkflowDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize workflow document: " + e.getOriginalMessage(), e);
        }
    }

    @NotNull
    public String toPrettyJson(@NotNull WorkflowDocument document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize workflow document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a workflow document
     */
    @NotNull
    public WorkflowDocument fromJson(@NotNull String json) {
        WorkflowDocument document;
        try {
            document = objectMapper.readValue(json, WorkflowDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow document: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.components() == null) {
            throw new IllegalArgumentException("Invalid workflow document: 'components' is required");
        }
        return document;
    }
}

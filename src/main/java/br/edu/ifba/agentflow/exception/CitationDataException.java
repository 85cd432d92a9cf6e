package br.edu.ifba.agentflow.exception;

/**
 * Raised when the serialized chunk payload of a retrieval result cannot be decoded.
 * Always recovered inside citation assembly.
 */
public class CitationDataException extends WorkflowException {

    public CitationDataException(final String message) {
        super(message);
    }

    public CitationDataException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

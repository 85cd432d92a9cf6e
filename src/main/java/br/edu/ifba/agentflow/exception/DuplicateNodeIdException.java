package br.edu.ifba.agentflow.exception;

/**
 * Thrown when a node is added under an id that already exists in the graph.
 */
public class DuplicateNodeIdException extends WorkflowException {

    public DuplicateNodeIdException(final String message) {
        super(message);
    }

    public DuplicateNodeIdException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package br.edu.ifba.agentflow.exception;

/**
 * Thrown when a node names a component type the registry does not know.
 */
public class UnknownComponentTypeException extends WorkflowException {

    public UnknownComponentTypeException(final String message) {
        super(message);
    }

    public UnknownComponentTypeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

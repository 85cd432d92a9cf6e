package br.edu.ifba.agentflow.exception;

/**
 * Wraps a failure of the generation backend. Generation failures are not
 * retried and propagate out of the stage.
 */
public class BackendFailureException extends WorkflowException {

    public BackendFailureException(final String message) {
        super(message);
    }

    public BackendFailureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package br.edu.ifba.agentflow.exception;

/**
 * Base type for failures raised while authoring or executing a workflow.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(final String message) {
        super(message);
    }

    public WorkflowException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

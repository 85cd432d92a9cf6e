package br.edu.ifba.agentflow.exception;

public class NodeNotFoundException extends WorkflowException {

    public NodeNotFoundException(final String message) {
        super(message);
    }

    public NodeNotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

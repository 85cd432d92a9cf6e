package br.edu.ifba.agentflow.exception;

/**
 * Raised by parameter validation when a component is activated.
 * Messages are qualified with the component type and the offending field.
 */
public class ConfigurationException extends WorkflowException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package br.edu.ifba.agentflow.adapters;

import br.edu.ifba.agentflow.exception.BackendFailureException;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the chat completion API into {@link BackendFailureException}s
 * carrying the status and the response body.
 */
public class LlmChatClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmChatClientExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (ProcessingException | IllegalStateException e) {
            LOG.warn("Failed to read error response body", e);
        }

        int status = response.getStatus();
        String statusInfo = response.getStatusInfo().getReasonPhrase();

        LOG.errorf("LLM API error: %d %s, body: %s", status, statusInfo,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty)");

        return new BackendFailureException(String.format(
            "LLM API returned %d %s%s",
            status,
            statusInfo,
            responseBody != null ? " - " + responseBody : ""
        ));
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}

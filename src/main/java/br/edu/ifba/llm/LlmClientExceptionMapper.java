package br.edu.ifba.llm;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Logs the body of failed chat and embedding calls before turning them into exceptions.
 */
public class LlmClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmClientExceptionMapper.class);

    private static final int MAX_BODY_LENGTH = 2000;

    @Override
    public RuntimeException toThrowable(final Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read error response body", e);
        }

        final int status = response.getStatus();
        final String reason = response.getStatusInfo().getReasonPhrase();
        if (responseBody != null && responseBody.length() > MAX_BODY_LENGTH) {
            responseBody = responseBody.substring(0, MAX_BODY_LENGTH) + "...";
        }
        LOG.errorf("LLM API error: %d %s, body: %s", status, reason,
                responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty)");

        return new WebApplicationException(
            String.format("LLM API returned %d %s%s", status, reason, responseBody != null ? " - " + responseBody : ""),
            response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}

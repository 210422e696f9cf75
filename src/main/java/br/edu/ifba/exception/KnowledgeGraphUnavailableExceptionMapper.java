package br.edu.ifba.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class KnowledgeGraphUnavailableExceptionMapper implements ExceptionMapper<KnowledgeGraphUnavailableException> {

    private static final Logger LOG = Logger.getLogger(KnowledgeGraphUnavailableExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final KnowledgeGraphUnavailableException exception) {
        LOG.errorf(exception, "Knowledge graph store unavailable");

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Service Unavailable",
            Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
            "Knowledge graph store is unavailable",
            uriInfo.getPath()
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}

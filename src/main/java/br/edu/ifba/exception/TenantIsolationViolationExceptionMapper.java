package br.edu.ifba.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Aborts the request. The body never carries the offending data or the foreign tenant id.
 */
@Provider
public class TenantIsolationViolationExceptionMapper implements ExceptionMapper<TenantIsolationViolationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final TenantIsolationViolationException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Internal Server Error",
            Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
            "Request aborted",
            uriInfo.getPath()
        );

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}

package br.edu.ifba.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class MissingTenantExceptionMapper implements ExceptionMapper<MissingTenantException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final MissingTenantException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Unauthorized",
            Response.Status.UNAUTHORIZED.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}

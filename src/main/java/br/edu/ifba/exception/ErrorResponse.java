package br.edu.ifba.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Problem details body (RFC 7807) returned by the exception mappers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {
}

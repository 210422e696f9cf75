package br.edu.ifba.query;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
    @NotBlank(message = "Query is required")
    String query,

    /**
     * Optional route profile. If null, the default profile is used.
     */
    String profile
) {
    public QueryRequest(final String query) {
        this(query, null);
    }
}

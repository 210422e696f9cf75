package br.edu.ifba.exception;

/**
 * The request carried no tenant header. Mapped to HTTP 401.
 */
public class MissingTenantException extends RuntimeException {

    public MissingTenantException(String headerName) {
        super("Missing required header " + headerName);
    }
}

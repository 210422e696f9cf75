package br.edu.ifba.exception;

/**
 * The request named a route profile that is not configured. Mapped to HTTP 400.
 */
public class UnknownProfileException extends RuntimeException {

    public UnknownProfileException(String profile) {
        super("Unknown profile: " + profile);
    }
}

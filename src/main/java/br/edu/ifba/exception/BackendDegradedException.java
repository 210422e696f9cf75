package br.edu.ifba.exception;

/**
 * The graph store lacks a capability a statement needs, e.g. native personalized ranking
 * or a vector index. Callers switch to an approximation and flag the result.
 */
public class BackendDegradedException extends RuntimeException {

    public BackendDegradedException(String message) {
        super(message);
    }
}

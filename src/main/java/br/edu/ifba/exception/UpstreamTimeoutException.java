package br.edu.ifba.exception;

import java.time.Duration;

/**
 * A store, embedding or completion call exceeded its timeout. Recoverable: callers
 * fall back to another route, a cheaper trace mode or the best answer so far.
 */
public class UpstreamTimeoutException extends RuntimeException {

    private final String operation;

    public UpstreamTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

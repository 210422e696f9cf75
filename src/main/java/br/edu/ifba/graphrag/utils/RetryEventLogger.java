package br.edu.ifba.graphrag.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for retried graph store statements.
 *
 * <p>MDC keys: {@code retry.operation}, {@code retry.attempt}, {@code retry.exception}.</p>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        try {
            putContext(operation, attempt, failure);
            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName(failure), truncate(failure));
        } finally {
            clearMDC();
        }
    }

    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        try {
            putContext(operation, totalAttempts, failure);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName(failure), truncate(failure));
        } finally {
            clearMDC();
        }
    }

    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void putContext(final String operation, final int attempt, final Throwable failure) {
        MDC.put(MDC_RETRY_OPERATION, operation);
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        MDC.put(MDC_RETRY_EXCEPTION, exceptionName(failure));
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private static String exceptionName(final Throwable failure) {
        return failure != null ? failure.getClass().getSimpleName() : "unknown";
    }

    private static String truncate(final Throwable failure) {
        final String message = failure != null ? failure.getMessage() : null;
        if (message == null) {
            return "no message";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}

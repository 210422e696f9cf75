package br.edu.ifba.graphrag.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link RetryEventLogger}.
 *
 * <p>Retry events of graph store calls are logged with MDC context that is removed again
 * after each event, leaving unrelated MDC keys untouched.</p>
 */
class RetryEventLoggerTest {

    private RetryEventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RetryEventLogger();
        MDC.clear();
    }

    @Nested
    @DisplayName("Retry attempts")
    class RetryAttempts {

        @Test
        @DisplayName("logRetryAttempt clears its MDC keys afterwards")
        void testLogRetryAttemptClearsContext() {
            final SQLException failure = new SQLException("Connection reset", "08006");

            logger.logRetryAttempt("NEIGHBORS_BATCH", 2, 3, failure);

            assertNull(MDC.get("retry.operation"));
            assertNull(MDC.get("retry.attempt"));
            assertNull(MDC.get("retry.exception"));
        }

        @Test
        @DisplayName("request context keys survive retry logging")
        void testRequestContextPreserved() {
            MDC.put("tenant", "acme");
            MDC.put("route", "local-graph-search");

            logger.logRetryAttempt("CHUNKS_FOR_ENTITIES", 1, 3, new SQLException("Deadlock", "40P01"));

            assertEquals("acme", MDC.get("tenant"));
            assertEquals("local-graph-search", MDC.get("route"));
        }

        @Test
        @DisplayName("null failures and messages are handled")
        void testNullFailure() {
            logger.logRetryAttempt("HUB_ENTITIES", 1, 3, null);
            logger.logRetryAttempt("HUB_ENTITIES", 1, 3, new RuntimeException((String) null));

            assertNull(MDC.get("retry.exception"));
        }

        @Test
        @DisplayName("long messages are truncated without failing")
        void testMessageTruncation() {
            final RuntimeException failure = new RuntimeException("x".repeat(500));

            logger.logRetryAttempt("ENTITY_CATALOG", 1, 3, failure);

            assertNull(MDC.get("retry.operation"));
        }
    }

    @Nested
    @DisplayName("Retry outcome")
    class RetryOutcome {

        @Test
        @DisplayName("logRetryExhausted clears its MDC keys afterwards")
        void testLogRetryExhausted() {
            logger.logRetryExhausted("MATCH_EXACT_NAME", 3, new SQLException("Too many connections", "53300"));

            assertNull(MDC.get("retry.operation"));
            assertNull(MDC.get("retry.attempt"));
        }

        @Test
        @DisplayName("logRetrySuccess is silent for first-attempt success")
        void testLogRetrySuccess() {
            logger.logRetrySuccess("ENTITIES_BY_ID", 1);
            logger.logRetrySuccess("ENTITIES_BY_ID", 3);

            assertNull(MDC.get("retry.operation"));
            assertNull(MDC.get("retry.attempt"));
        }
    }
}

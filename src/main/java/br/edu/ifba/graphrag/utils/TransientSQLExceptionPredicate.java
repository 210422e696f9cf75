package br.edu.ifba.graphrag.utils;

import br.edu.ifba.exception.TenantIsolationViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a graph store failure is worth retrying.
 *
 * <p>Retryable: SQLSTATE classes 08 (connection), 40 (rollback/deadlock),
 * 53 (insufficient resources) and 57 (operator intervention), the JDBC transient
 * exception types, and messages that describe lost connections or network trouble.
 * Tenant isolation violations are never retried.</p>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class TransientSQLExceptionPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientSQLExceptionPredicate.class);

    private static final Set<String> TRANSIENT_SQLSTATE_CLASSES = Set.of("08", "40", "53", "57");

    private static final Pattern TRANSIENT_MESSAGE = Pattern.compile(
        "(?i)(connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|attempt\\s+failed)"
            + "|unable\\s+to\\s+(connect|acquire\\s+connection)"
            + "|too\\s+many\\s+(connections|clients)"
            + "|socket\\s+(timeout|closed|reset)"
            + "|i/o\\s+error"
            + "|read\\s+timed\\s*out"
            + "|terminating\\s+connection"
            + "|deadlock\\s+detected"
            + "|could\\s+not\\s+serialize\\s+access"
            + "|temporarily\\s+unavailable)");

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof TenantIsolationViolationException) {
                return false;
            }
            if (current instanceof SQLTransientConnectionException || current instanceof SQLTimeoutException) {
                logger.debug("Transient JDBC exception: {}", current.getMessage());
                return true;
            }
            if (current instanceof SQLException sql && isTransient(sql)) {
                return true;
            }
            if (matchesTransientMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    /**
     * True for connection-class failures (SQLSTATE 08) and connection-refused style messages,
     * which mean the store itself is unreachable rather than busy.
     */
    public static boolean isConnectionFailure(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLTransientConnectionException) {
                return true;
            }
            if (current instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase().contains("connection") && matchesTransientMessage(message)) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    private static boolean isTransient(final SQLException exception) {
        for (SQLException e = exception; e != null; e = e.getNextException()) {
            final String state = e.getSQLState();
            if (state != null && state.length() >= 2 && TRANSIENT_SQLSTATE_CLASSES.contains(state.substring(0, 2))) {
                logger.debug("Transient SQLSTATE {}: {}", state, e.getMessage());
                return true;
            }
            if (matchesTransientMessage(e.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesTransientMessage(final String message) {
        return message != null && !message.isEmpty() && TRANSIENT_MESSAGE.matcher(message).find();
    }
}

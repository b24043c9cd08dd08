package br.edu.ifba.graphsync.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a relational failure is a transient connectivity problem.
 *
 * <p>The record repository uses it to tell connectivity failures (which abort an export
 * run) from statement failures, and {@code GraphSyncService#verify} uses it with
 * {@code @RetryWhen} so that read-only verification is retried on the same conditions.</p>
 *
 * <h2>Transient SQLSTATE classes:</h2>
 * <ul>
 *   <li><b>08xxx</b> - Connection exceptions</li>
 *   <li><b>40xxx</b> - Transaction rollback (deadlock, serialization failure)</li>
 *   <li><b>53xxx</b> - Insufficient resources</li>
 *   <li><b>57xxx</b> - Operator intervention (shutdown, query canceled)</li>
 * </ul>
 *
 * <p>Drivers that leave SQLSTATE empty (SQLite, some Snowflake network errors) are
 * classified by message. The cause chain and {@link SQLException#getNextException()} chain
 * are both inspected.</p>
 */
public final class TransientSQLExceptionPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientSQLExceptionPredicate.class);

    private static final Set<String> TRANSIENT_SQLSTATE_PREFIXES = Set.of("08", "40", "53", "57");

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|broken)" +
        "|unable\\s+to\\s+(connect|acquire\\s+connection)" +
        "|too\\s+many\\s+(connections|clients)" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset|error)" +
        "|i/o\\s+error" +
        "|read\\s+timed\\s*out" +
        "|connect\\s+timed\\s*out" +
        "|server\\s+(closed|shutdown|restarting|not\\s+available)" +
        "|communication\\s+error" +
        "|session\\s+(no\\s+longer\\s+exists|expired)" +
        "|authentication\\s+token\\s+has\\s+expired" +
        "|database\\s+(is\\s+locked|unavailable|shutdown|restarting)" +
        "|sqlite_busy" +
        "|deadlock\\s+detected" +
        "|lock\\s+wait\\s+timeout" +
        "|temporarily\\s+unavailable" +
        "|try\\s+(again|later)" +
        ")"
    );

    /**
     * Tests whether the given exception, or anything in its cause chain, is a transient
     * relational failure.
     *
     * @param throwable the exception to test (may be null)
     * @return {@code true} if the failure is transient
     */
    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (isTransient(current)) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause == current ? null : cause;
        }
        return false;
    }

    private boolean isTransient(final Throwable throwable) {
        if (throwable instanceof SQLTransientConnectionException
                || throwable instanceof SQLRecoverableException
                || throwable instanceof SQLTimeoutException) {
            logger.debug("Transient SQL exception type {}: {}",
                throwable.getClass().getSimpleName(), throwable.getMessage());
            return true;
        }

        if (throwable instanceof SQLException sqlException) {
            SQLException next = sqlException;
            while (next != null) {
                if (isTransientSqlState(next.getSQLState()) || isTransientByMessage(next.getMessage())) {
                    return true;
                }
                SQLException following = next.getNextException();
                next = following == next ? null : following;
            }
            return false;
        }

        return isTransientByMessage(throwable.getMessage());
    }

    private boolean isTransientSqlState(final String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return false;
        }
        if (TRANSIENT_SQLSTATE_PREFIXES.contains(sqlState.substring(0, 2))) {
            logger.debug("Transient SQLSTATE detected: {}", sqlState);
            return true;
        }
        return false;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient failure detected by message pattern: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }
        return false;
    }
}

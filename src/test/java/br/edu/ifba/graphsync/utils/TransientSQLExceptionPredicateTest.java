package br.edu.ifba.graphsync.utils;

import br.edu.ifba.graphsync.source.RecordSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TransientSQLExceptionPredicate}.
 *
 * SQLSTATE classes 08, 40, 53 and 57 are transient; 23 and 42 are permanent.
 * Drivers without SQLSTATE (SQLite, Snowflake network errors) are classified by message.
 */
class TransientSQLExceptionPredicateTest {

    private TransientSQLExceptionPredicate predicate;

    @BeforeEach
    void setUp() {
        predicate = new TransientSQLExceptionPredicate();
    }

    @Nested
    @DisplayName("SQLSTATE classes")
    class SqlStates {

        @Test
        @DisplayName("should return true for connection exceptions (08xxx)")
        void testConnectionException() {
            assertTrue(predicate.test(new SQLException("Connection failed", "08001")));
            assertTrue(predicate.test(new SQLException("Connection does not exist", "08003")));
        }

        @Test
        @DisplayName("should return true for transaction rollback (40xxx)")
        void testTransactionRollback() {
            assertTrue(predicate.test(new SQLException("Serialization failure", "40001")));
        }

        @Test
        @DisplayName("should return true for insufficient resources (53xxx)")
        void testInsufficientResources() {
            assertTrue(predicate.test(new SQLException("Out of memory", "53200")));
        }

        @Test
        @DisplayName("should return true for operator intervention (57xxx)")
        void testOperatorIntervention() {
            assertTrue(predicate.test(new SQLException("Query canceled", "57014")));
        }
    }

    @Nested
    @DisplayName("Java SQL Transient Exception Types")
    class JavaTransientExceptions {

        @Test
        @DisplayName("should return true for SQLTransientConnectionException")
        void testTransientConnection() {
            assertTrue(predicate.test(new SQLTransientConnectionException("Transient connection issue")));
        }

        @Test
        @DisplayName("should return true for SQLTimeoutException")
        void testTimeout() {
            assertTrue(predicate.test(new SQLTimeoutException("Query timed out")));
        }

        @Test
        @DisplayName("should return true for SQLRecoverableException")
        void testRecoverable() {
            assertTrue(predicate.test(new SQLRecoverableException("Recoverable")));
        }
    }

    @Nested
    @DisplayName("Message patterns")
    class MessagePatterns {

        @Test
        @DisplayName("should return true for a busy SQLite database")
        void testSqliteBusy() {
            assertTrue(predicate.test(new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)")));
        }

        @Test
        @DisplayName("should return true for Snowflake communication errors")
        void testSnowflakeNetwork() {
            assertTrue(predicate.test(new SQLException("JDBC driver encountered communication error. Message: HTTP status=503")));
            assertTrue(predicate.test(new SQLException("Session no longer exists. New login required to access the service.")));
        }

        @Test
        @DisplayName("should inspect chained next exceptions")
        void testNextException() {
            SQLException batch = new SQLException("Batch entry 0 failed", "XX000");
            batch.setNextException(new SQLException("Connection reset", (String) null));
            assertTrue(predicate.test(batch));
        }
    }

    @Nested
    @DisplayName("Permanent Errors (should NOT retry)")
    class PermanentErrors {

        @Test
        @DisplayName("should return false for SQLSTATE 23505 (unique constraint violation)")
        void testUniqueViolation() {
            assertFalse(predicate.test(new SQLException("Duplicate key", "23505")));
        }

        @Test
        @DisplayName("should return false for SQLSTATE 42601 (syntax error)")
        void testSyntaxError() {
            assertFalse(predicate.test(new SQLException("Syntax error", "42601")));
        }

        @Test
        @DisplayName("should return false for SQLSTATE 42S02 (object does not exist)")
        void testUndefinedTable() {
            assertFalse(predicate.test(new SQLException("Object 'ENTITY_RECORDS' does not exist", "42S02")));
        }
    }

    @Nested
    @DisplayName("Cause Chain Traversal")
    class CauseChainTraversal {

        @Test
        @DisplayName("should return true when a record store failure wraps a connection failure")
        void testWrappedByRecordSourceException() {
            SQLException cause = new SQLException("Connection failed", "08006");
            RecordSourceException wrapper = new RecordSourceException(cause.getMessage(), "readEntities", true, cause);
            assertTrue(predicate.test(wrapper));
        }

        @Test
        @DisplayName("should return true for deeply nested transient exception")
        void testDeepNesting() {
            SQLException root = new SQLException("Deadlock", "40001");
            SQLException middle = new SQLException("SQL error", "00000", root);
            assertTrue(predicate.test(new RuntimeException("Wrapper", middle)));
        }

        @Test
        @DisplayName("should return false when the only SQL failure is permanent")
        void testPermanentCause() {
            SQLException cause = new SQLException("Constraint violation", "23505");
            assertFalse(predicate.test(new RuntimeException("Wrapper", cause)));
        }

        @Test
        @DisplayName("should return false for non-SQL exceptions without transient messages")
        void testNonSql() {
            assertFalse(predicate.test(new IllegalArgumentException("bad input")));
        }
    }

    @Nested
    @DisplayName("Edge Cases")
    class EdgeCases {

        @Test
        @DisplayName("should return false for null input")
        void testNull() {
            assertFalse(predicate.test(null));
        }

        @Test
        @DisplayName("should return false for SQLException with null SQLSTATE and message")
        void testNullState() {
            assertFalse(predicate.test(new SQLException((String) null, (String) null)));
        }
    }
}

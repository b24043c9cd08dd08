package br.edu.ifba.graphsync.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SqlDialectTest {

    @Test
    @DisplayName("should resolve dialect names ignoring case and whitespace")
    void testFromName() {
        assertEquals(SqlDialect.SNOWFLAKE, SqlDialect.fromName("Snowflake"));
        assertEquals(SqlDialect.SQLITE, SqlDialect.fromName(" sqlite "));
        assertThrows(IllegalArgumentException.class, () -> SqlDialect.fromName("oracle"));
    }

    @Test
    @DisplayName("should ship a migration script for every dialect")
    void testMigrationScriptsOnClasspath() {
        for (SqlDialect dialect : SqlDialect.values()) {
            assertNotNull(SqlDialect.class.getResource(dialect.migrationPath() + "V001__sync_records.sql"),
                "missing migration for " + dialect);
        }
    }

    @Test
    @DisplayName("should build a rewriter around the dialect's parse function")
    void testWriteInterceptor() {
        WriteStatementInterceptor interceptor = SqlDialect.SQLITE.writeInterceptor();
        InsertSelectRewriter rewriter = assertInstanceOf(InsertSelectRewriter.class, interceptor);
        assertEquals("json", rewriter.getParseFunction());
        assertEquals("INSERT INTO t (a) SELECT json(?)",
            interceptor.beforeExecute("INSERT INTO t (a) VALUES (?)", List.of(SemiStructuredParameter.of("{}"))));
    }
}

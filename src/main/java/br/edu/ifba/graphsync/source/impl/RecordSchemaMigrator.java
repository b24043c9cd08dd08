package br.edu.ifba.graphsync.source.impl;

import br.edu.ifba.graphsync.codec.SqlDialect;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the record store schema migrations for a dialect.
 *
 * <p>Scripts live on the classpath under {@code /db/migrations/<dialect>/} and are named
 * {@code V{version}__{description}.sql}. Applied versions are tracked in
 * {@code schema_version}.</p>
 */
public final class RecordSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(RecordSchemaMigrator.class);

    private static final String VERSION_TABLE_DDL =
        "CREATE TABLE IF NOT EXISTS schema_version ("
            + "version INTEGER NOT NULL PRIMARY KEY, "
            + "description VARCHAR(255) NOT NULL)";

    private final SqlDialect dialect;
    private final List<Migration> migrations;

    public RecordSchemaMigrator(SqlDialect dialect) {
        this.dialect = dialect;
        this.migrations = List.of(
            new Migration(1, "sync_records", dialect.migrationPath() + "V001__sync_records.sql")
        );
    }

    /**
     * Gets the highest applied version.
     *
     * @param conn database connection
     * @return current version, 0 when nothing has been applied
     * @throws SQLException if the version table cannot be read
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(VERSION_TABLE_DDL);
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                return rs.wasNull() ? 0 : version;
            }
            return 0;
        }
    }

    /**
     * Applies all pending migrations in one transaction.
     *
     * @param conn database connection
     * @return number of migrations applied
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public int migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Record store schema version: %d (%s)", currentVersion, dialect);

        boolean autoCommit = conn.getAutoCommit();
        int applied = 0;
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    for (String statement : splitStatements(loadResource(migration.resourcePath()))) {
                        try (Statement stmt = conn.createStatement()) {
                            stmt.execute(statement);
                        }
                    }
                    try (PreparedStatement ps = conn.prepareStatement(
                            "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                        ps.setInt(1, migration.version());
                        ps.setString(2, migration.description());
                        ps.executeUpdate();
                    }
                    applied++;
                }
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
        if (applied > 0) {
            LOG.infof("Applied %d record store migration(s)", applied);
        }
        return applied;
    }

    public int getLatestVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    private String loadResource(String resourcePath) {
        InputStream is = getClass().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("Migration resource not found: " + resourcePath);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load migration: " + resourcePath, e);
        }
    }

    /**
     * Splits a script into statements on semicolons outside quotes, dropping {@code --}
     * comment lines.
     */
    static List<String> splitStatements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ';') {
                addStatement(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    record Migration(int version, String description, String resourcePath) {
    }
}

package br.edu.ifba.graphsync.source.impl;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Hands out validated connections to the relational record store.
 *
 * <p>Each connection is checked before use so that a stale pooled connection surfaces as a
 * connectivity failure instead of a statement failure halfway through a page read.</p>
 */
public class JdbcConnectionProvider {

    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectionProvider.class);

    private static final String VALIDATION_QUERY = "SELECT 1";

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;

    public JdbcConnectionProvider(@NotNull DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Gets a validated connection from the data source.
     *
     * @return a healthy connection; the caller closes it
     * @throws SQLException if no connection can be obtained or it fails validation
     */
    @NotNull
    public Connection getConnection() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            validateConnection(connection);
            return connection;
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new SQLException("Connection validation failed: " + e.getMessage(), "08003", e);
        }
    }

    /**
     * Validates that a connection is open and answering.
     *
     * <p>Uses {@link Connection#isValid(int)} first and falls back to a trivial query when
     * the driver does not support it.</p>
     *
     * @param connection the connection to validate
     * @throws SQLException if the connection is unusable
     */
    public void validateConnection(Connection connection) throws SQLException {
        if (connection == null) {
            throw new SQLException("Connection is null");
        }
        if (connection.isClosed()) {
            throw new SQLException("Connection is closed");
        }
        try {
            if (connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                logger.trace("Connection validated via isValid()");
                return;
            }
        } catch (SQLException e) {
            logger.trace("isValid() not usable, falling back to query validation: {}", e.getMessage());
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.setQueryTimeout(VALIDATION_TIMEOUT_SECONDS);
            stmt.execute(VALIDATION_QUERY);
            logger.trace("Connection validated via query");
        }
    }

    private void closeQuietly(Connection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.debug("Error closing invalid connection: {}", e.getMessage());
            }
        }
    }
}

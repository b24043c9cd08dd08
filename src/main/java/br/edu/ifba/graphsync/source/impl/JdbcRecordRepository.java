package br.edu.ifba.graphsync.source.impl;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.codec.SemiStructuredParameter;
import br.edu.ifba.graphsync.codec.SqlDialect;
import br.edu.ifba.graphsync.codec.WriteStatementInterceptor;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.source.RecordSource;
import br.edu.ifba.graphsync.source.RecordSourceException;
import br.edu.ifba.graphsync.utils.TransientSQLExceptionPredicate;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JDBC implementation of the relational record store.
 *
 * <p>Reads use keyset pagination ({@code id > ? ORDER BY id LIMIT n}) together with
 * {@link java.sql.Statement#setMaxRows(int)} and a query timeout, so no read is unbounded.
 * Writes go through the dialect's {@link WriteStatementInterceptor}, which reshapes
 * multi-row inserts so the semi-structured {@code attributes} column receives parsed
 * values.</p>
 *
 * <p>Scope membership: an entity is in {@code file:<id>} when its {@code source_file_id}
 * matches; a relationship is in it when its source entity is. Relationship endpoint types
 * are resolved against the whole store.</p>
 */
public class JdbcRecordRepository implements RecordSource {

    private static final Logger LOG = Logger.getLogger(JdbcRecordRepository.class);

    /** Rows per multi-row insert statement; keeps bind variables well under driver limits. */
    static final int INSERT_CHUNK_SIZE = 100;

    private static final String ENTITY_COLUMNS = "id, entity_type, display_name, attributes, source_file_id";

    private static final String RELATIONSHIP_SELECT =
        "SELECT r.id, r.relationship_type, r.source_entity_id, r.target_entity_id, r.attributes, "
            + "s.entity_type AS source_type, t.entity_type AS target_type, s.source_file_id AS source_file_id "
            + "FROM relationship_records r ";

    private final JdbcConnectionProvider connections;
    private final SqlDialect dialect;
    private final SemiStructuredCodec codec;
    private final WriteStatementInterceptor interceptor;
    private final int queryTimeoutSeconds;
    private final TransientSQLExceptionPredicate transientPredicate = new TransientSQLExceptionPredicate();

    public JdbcRecordRepository(
            @NotNull JdbcConnectionProvider connections,
            @NotNull SqlDialect dialect,
            @NotNull SemiStructuredCodec codec,
            int queryTimeoutSeconds) {
        this(connections, dialect, codec, dialect.writeInterceptor(), queryTimeoutSeconds);
    }

    public JdbcRecordRepository(
            @NotNull JdbcConnectionProvider connections,
            @NotNull SqlDialect dialect,
            @NotNull SemiStructuredCodec codec,
            @NotNull WriteStatementInterceptor interceptor,
            int queryTimeoutSeconds) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.interceptor = Objects.requireNonNull(interceptor, "interceptor must not be null");
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must not be negative");
        }
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Applies pending schema migrations.
     */
    public void initialize() {
        execute("initialize", conn -> {
            new RecordSchemaMigrator(dialect).migrateToLatest(conn);
            return null;
        });
        LOG.infof("Initialized JdbcRecordRepository (%s)", dialect);
    }

    // ===== Write path =====

    /**
     * Inserts entity records in one transaction.
     *
     * @param entities records to insert
     * @return number of rows inserted
     * @throws br.edu.ifba.graphsync.codec.SemiStructuredEncodingException if an attribute
     *         value cannot be encoded; nothing is inserted in that case
     */
    public int insertEntities(@NotNull List<EntityRecord> entities) {
        if (entities.isEmpty()) {
            return 0;
        }
        List<List<Object>> rows = new ArrayList<>(entities.size());
        for (EntityRecord entity : entities) {
            rows.add(List.of(
                entity.id(),
                entity.entityType(),
                nullable(entity.displayName()),
                SemiStructuredParameter.of(entity.attributes()),
                nullable(entity.sourceFileId())));
        }
        int inserted = insertRows("insertEntities", "entity_records", ENTITY_COLUMNS, rows);
        LOG.debugf("Inserted %d entity records", inserted);
        return inserted;
    }

    /**
     * Inserts relationship records in one transaction. Endpoints are not checked.
     *
     * @param relationships records to insert
     * @return number of rows inserted
     */
    public int insertRelationships(@NotNull List<RelationshipRecord> relationships) {
        if (relationships.isEmpty()) {
            return 0;
        }
        List<List<Object>> rows = new ArrayList<>(relationships.size());
        for (RelationshipRecord relationship : relationships) {
            rows.add(List.of(
                relationship.id(),
                relationship.relationshipType(),
                relationship.sourceEntityId(),
                relationship.targetEntityId(),
                SemiStructuredParameter.of(relationship.attributes())));
        }
        int inserted = insertRows("insertRelationships", "relationship_records",
            "id, relationship_type, source_entity_id, target_entity_id, attributes", rows);
        LOG.debugf("Inserted %d relationship records", inserted);
        return inserted;
    }

    private int insertRows(String operation, String table, String columns, List<List<Object>> rows) {
        return execute(operation, conn -> {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int inserted = 0;
                for (int from = 0; from < rows.size(); from += INSERT_CHUNK_SIZE) {
                    List<List<Object>> chunk = rows.subList(from, Math.min(rows.size(), from + INSERT_CHUNK_SIZE));
                    inserted += insertChunk(conn, table, columns, chunk);
                }
                conn.commit();
                return inserted;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        });
    }

    private int insertChunk(Connection conn, String table, String columns, List<List<Object>> chunk)
            throws SQLException {
        List<Object> parameters = new ArrayList<>();
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table)
            .append(" (").append(columns).append(") VALUES ");
        for (int i = 0; i < chunk.size(); i++) {
            List<Object> row = chunk.get(i);
            sql.append(i == 0 ? "" : ", ").append('(');
            for (int c = 0; c < row.size(); c++) {
                sql.append(c == 0 ? "?" : ", ?");
            }
            sql.append(')');
            parameters.addAll(row);
        }

        String statement = interceptor.beforeExecute(sql.toString(), parameters);
        LOG.tracef("Executing insert: %s", statement.length() > 200 ? statement.substring(0, 200) + "..." : statement);
        try (PreparedStatement ps = conn.prepareStatement(statement)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            bind(ps, parameters);
            return ps.executeUpdate();
        }
    }

    // ===== Read path =====

    @Override
    @NotNull
    public List<String> distinctEntityTypes(@NotNull SyncScope scope) {
        String sql = "SELECT DISTINCT entity_type FROM entity_records"
            + (scope.isAll() ? "" : " WHERE source_file_id = ?")
            + " ORDER BY entity_type";
        return query("distinctEntityTypes", sql, scopeParameters(scope), 0, rs -> rs.getString(1));
    }

    @Override
    @NotNull
    public List<EntityRecord> readEntities(
            @NotNull SyncScope scope,
            @NotNull Collection<String> rawTypes,
            @Nullable String afterId,
            int limit) {
        requirePositive(limit);
        if (rawTypes.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> parameters = new ArrayList<>(rawTypes);
        StringBuilder sql = new StringBuilder("SELECT ").append(ENTITY_COLUMNS)
            .append(" FROM entity_records WHERE entity_type IN (")
            .append(String.join(", ", Collections.nCopies(rawTypes.size(), "?")))
            .append(')');
        if (!scope.isAll()) {
            sql.append(" AND source_file_id = ?");
            parameters.add(scope.sourceFileId());
        }
        if (afterId != null) {
            sql.append(" AND id > ?");
            parameters.add(afterId);
        }
        sql.append(" ORDER BY id LIMIT ").append(limit);
        return query("readEntities", sql.toString(), parameters, limit, this::mapEntity);
    }

    @Override
    @NotNull
    public List<ResolvedRelationship> readRelationships(@NotNull SyncScope scope, @Nullable String afterId, int limit) {
        requirePositive(limit);
        List<Object> parameters = new ArrayList<>(scopeParameters(scope));
        StringBuilder sql = new StringBuilder(RELATIONSHIP_SELECT).append(relationshipJoins(scope));
        if (afterId != null) {
            sql.append(" WHERE r.id > ?");
            parameters.add(afterId);
        }
        sql.append(" ORDER BY r.id LIMIT ").append(limit);
        return query("readRelationships", sql.toString(), parameters, limit, this::mapRelationship);
    }

    @Override
    public long countEntities(@NotNull SyncScope scope) {
        String sql = "SELECT COUNT(*) FROM entity_records" + (scope.isAll() ? "" : " WHERE source_file_id = ?");
        return query("countEntities", sql, scopeParameters(scope), 1, rs -> rs.getLong(1)).get(0);
    }

    @Override
    public long countRelationships(@NotNull SyncScope scope) {
        String sql = scope.isAll()
            ? "SELECT COUNT(*) FROM relationship_records"
            : "SELECT COUNT(*) FROM relationship_records r "
                + "JOIN entity_records s ON s.id = r.source_entity_id AND s.source_file_id = ?";
        return query("countRelationships", sql, scopeParameters(scope), 1, rs -> rs.getLong(1)).get(0);
    }

    @Override
    @NotNull
    public List<EntityRecord> sampleEntities(@NotNull SyncScope scope, int size) {
        if (size <= 0) {
            return Collections.emptyList();
        }
        String sql = "SELECT " + ENTITY_COLUMNS + " FROM entity_records"
            + (scope.isAll() ? "" : " WHERE source_file_id = ?")
            + " ORDER BY " + dialect.randomFunction() + " LIMIT " + size;
        return query("sampleEntities", sql, scopeParameters(scope), size, this::mapEntity);
    }

    @Override
    @NotNull
    public List<ResolvedRelationship> sampleRelationships(@NotNull SyncScope scope, int size) {
        if (size <= 0) {
            return Collections.emptyList();
        }
        String sql = RELATIONSHIP_SELECT + relationshipJoins(scope)
            + " ORDER BY " + dialect.randomFunction() + " LIMIT " + size;
        return query("sampleRelationships", sql, scopeParameters(scope), size, this::mapRelationship);
    }

    private static String relationshipJoins(SyncScope scope) {
        String source = scope.isAll()
            ? "LEFT JOIN entity_records s ON s.id = r.source_entity_id "
            : "JOIN entity_records s ON s.id = r.source_entity_id AND s.source_file_id = ? ";
        return source + "LEFT JOIN entity_records t ON t.id = r.target_entity_id";
    }

    private static List<Object> scopeParameters(SyncScope scope) {
        return scope.isAll() ? Collections.emptyList() : List.of(scope.sourceFileId());
    }

    private EntityRecord mapEntity(ResultSet rs) throws SQLException {
        return new EntityRecord(
            rs.getString("id"),
            rs.getString("entity_type"),
            rs.getString("display_name"),
            codec.decodeAttributes(rs.getObject("attributes")),
            rs.getString("source_file_id"));
    }

    private ResolvedRelationship mapRelationship(ResultSet rs) throws SQLException {
        RelationshipRecord record = new RelationshipRecord(
            rs.getString("id"),
            rs.getString("relationship_type"),
            rs.getString("source_entity_id"),
            rs.getString("target_entity_id"),
            codec.decodeAttributes(rs.getObject("attributes")));
        return new ResolvedRelationship(record, rs.getString("source_type"), rs.getString("target_type"),
            rs.getString("source_file_id"));
    }

    // ===== JDBC plumbing =====

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> query(String operation, String sql, List<?> parameters, int maxRows, RowMapper<T> mapper) {
        return execute(operation, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                if (maxRows > 0) {
                    ps.setMaxRows(maxRows);
                }
                bind(ps, parameters);
                List<T> results = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        results.add(mapper.map(rs));
                    }
                }
                LOG.tracef("%s returned %d row(s)", operation, results.size());
                return results;
            }
        });
    }

    private <T> T execute(String operation, SqlWork<T> work) {
        try (Connection conn = connections.getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            boolean connectivity = transientPredicate.test(e);
            LOG.debugf("%s failed (connectivity=%s): %s", operation, connectivity, e.getMessage());
            throw new RecordSourceException(e.getMessage(), operation, connectivity, e);
        }
    }

    private void bind(PreparedStatement ps, List<?> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            int index = i + 1;
            if (value instanceof SemiStructuredParameter semi) {
                String json = codec.toJson(codec.encode(semi.value()));
                if (json == null) {
                    ps.setNull(index, Types.VARCHAR);
                } else {
                    ps.setString(index, json);
                }
            } else if (value == null || value == NullValue.INSTANCE) {
                ps.setNull(index, Types.VARCHAR);
            } else if (value instanceof String text) {
                ps.setString(index, text);
            } else {
                ps.setObject(index, value);
            }
        }
    }

    private static Object nullable(@Nullable String value) {
        return value == null ? NullValue.INSTANCE : value;
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            LOG.warn("Failed to rollback", rollbackEx);
        }
    }

    /** Placeholder for SQL NULL in row lists built with {@link List#of}, which rejects nulls. */
    private enum NullValue {
        INSTANCE
    }
}

package br.edu.ifba.graphsync.graph.impl;

import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.graph.CypherStatements;
import br.edu.ifba.graphsync.graph.GraphBatchTimeoutException;
import br.edu.ifba.graphsync.graph.GraphNode;
import br.edu.ifba.graphsync.graph.GraphRelationship;
import br.edu.ifba.graphsync.graph.GraphSink;
import br.edu.ifba.graphsync.graph.GraphSinkException;
import br.edu.ifba.graphsync.graph.GraphStatement;
import br.edu.ifba.graphsync.graph.GraphStoreUnavailableException;
import br.edu.ifba.graphsync.graph.GraphTransaction;
import br.edu.ifba.graphsync.graph.NodeWrite;
import br.edu.ifba.graphsync.graph.RelationshipWrite;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Graph sink backed by Neo4j through the official Java driver.
 *
 * <p>Every call runs in an explicit transaction with a timeout: writes through
 * {@link #beginTransaction(Duration)}, reads and maintenance with {@code operationTimeout}.
 * Driver exceptions are translated into the {@link GraphSinkException} hierarchy.</p>
 */
public class Neo4jGraphSink implements GraphSink {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jGraphSink.class);

    private final Driver driver;
    private final SessionConfig sessionConfig;
    private final Duration operationTimeout;

    /**
     * Creates a sink on an open driver. The sink owns the driver and closes it.
     *
     * @param driver the Neo4j driver
     * @param database target database, or null for the server default
     * @param operationTimeout timeout for reads, index creation and clearing batches
     */
    public Neo4jGraphSink(@NotNull Driver driver, @Nullable String database, @NotNull Duration operationTimeout) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.sessionConfig = database == null || database.isBlank()
            ? SessionConfig.defaultConfig()
            : SessionConfig.forDatabase(database);
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout must not be null");
    }

    @Override
    public void createIdIndex(@NotNull String label) {
        GraphStatement statement = CypherStatements.createIdIndex(label);
        inTransaction("createIdIndex", tx -> tx.run(statement.cypher(), statement.parameters()).consume());
        logger.debug("Ensured id index for label {}", label);
    }

    @Override
    public long clearScope(@NotNull SyncScope scope, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        long relationships = deleteInBatches("clearScope", CypherStatements.deleteRelationshipBatch(scope, batchSize));
        long nodes = deleteInBatches("clearScope", CypherStatements.deleteNodeBatch(scope, batchSize));
        logger.info("Cleared scope {}: {} node(s), {} relationship(s) deleted", scope, nodes, relationships);
        return nodes;
    }

    private long deleteInBatches(String operation, GraphStatement statement) {
        long total = 0;
        long deleted;
        do {
            deleted = inTransaction(operation,
                tx -> tx.run(statement.cypher(), statement.parameters()).single().get("deleted").asLong());
            total += deleted;
        } while (deleted > 0);
        return total;
    }

    @Override
    @NotNull
    public GraphTransaction beginTransaction(@NotNull Duration timeout) {
        Session session = null;
        try {
            session = driver.session(sessionConfig);
            Transaction tx = session.beginTransaction(TransactionConfig.builder().withTimeout(timeout).build());
            return new Neo4jTransaction(session, tx);
        } catch (Neo4jException e) {
            if (session != null) {
                closeSession(session);
            }
            throw translate("beginTransaction", e);
        }
    }

    @Override
    public long countNodes(@NotNull SyncScope scope) {
        return count("countNodes", CypherStatements.countNodes(scope));
    }

    @Override
    public long countRelationships(@NotNull SyncScope scope) {
        return count("countRelationships", CypherStatements.countRelationships(scope));
    }

    private long count(String operation, GraphStatement statement) {
        return inTransaction(operation,
            tx -> tx.run(statement.cypher(), statement.parameters()).single().get("total").asLong());
    }

    @Override
    @NotNull
    public Optional<GraphNode> findNode(@NotNull String label, @NotNull String id) {
        GraphStatement statement = CypherStatements.findNode(label, id);
        List<Record> records = inTransaction("findNode",
            tx -> tx.run(statement.cypher(), statement.parameters()).list());
        if (records.isEmpty()) {
            return Optional.empty();
        }
        Record record = records.get(0);
        return Optional.of(new GraphNode(
            new HashSet<>(record.get("labels").asList(Value::asString)),
            record.get("props").asMap()));
    }

    @Override
    @NotNull
    public Optional<GraphRelationship> findRelationship(@NotNull String type, @NotNull String id) {
        GraphStatement statement = CypherStatements.findRelationship(type, id);
        List<Record> records = inTransaction("findRelationship",
            tx -> tx.run(statement.cypher(), statement.parameters()).list());
        if (records.isEmpty()) {
            return Optional.empty();
        }
        Record record = records.get(0);
        return Optional.of(new GraphRelationship(
            record.get("type").asString(),
            record.get("source_id").asString(),
            record.get("target_id").asString(),
            record.get("props").asMap()));
    }

    @Override
    public void close() {
        logger.info("Closing Neo4j driver");
        driver.close();
    }

    private <T> T inTransaction(String operation, Function<Transaction, T> work) {
        try (Session session = driver.session(sessionConfig);
             Transaction tx = session.beginTransaction(TransactionConfig.builder().withTimeout(operationTimeout).build())) {
            T result = work.apply(tx);
            tx.commit();
            return result;
        } catch (Neo4jException e) {
            throw translate(operation, e);
        }
    }

    /**
     * Maps driver exceptions onto the sink exception hierarchy.
     */
    static GraphSinkException translate(String operation, Neo4jException e) {
        if (e instanceof ServiceUnavailableException || e instanceof SessionExpiredException) {
            return new GraphStoreUnavailableException(e.getMessage(), operation, e);
        }
        String code = e.code();
        if (code != null && code.contains("TransactionTimedOut")) {
            return new GraphBatchTimeoutException(e.getMessage(), operation, e);
        }
        return new GraphSinkException(e.getMessage(), operation, e);
    }

    private static void closeSession(Session session) {
        try {
            session.close();
        } catch (Neo4jException e) {
            logger.warn("Failed to close Neo4j session: {}", e.getMessage());
        }
    }

    /**
     * Write transaction wrapping a driver session and transaction.
     */
    static final class Neo4jTransaction implements GraphTransaction {

        private final Session session;
        private final Transaction tx;

        Neo4jTransaction(Session session, Transaction tx) {
            this.session = session;
            this.tx = tx;
        }

        @Override
        public void mergeNode(@NotNull NodeWrite node) {
            GraphStatement statement = CypherStatements.mergeNode(node);
            try {
                tx.run(statement.cypher(), statement.parameters()).consume();
            } catch (Neo4jException e) {
                throw translate("mergeNode", e);
            }
        }

        @Override
        public boolean mergeRelationship(@NotNull RelationshipWrite relationship) {
            GraphStatement statement = CypherStatements.mergeRelationship(relationship);
            try {
                return tx.run(statement.cypher(), statement.parameters()).single().get("written").asLong() > 0;
            } catch (Neo4jException e) {
                throw translate("mergeRelationship", e);
            }
        }

        @Override
        public void commit() {
            try {
                tx.commit();
            } catch (Neo4jException e) {
                throw translate("commit", e);
            }
        }

        @Override
        public void rollback() {
            try {
                if (tx.isOpen()) {
                    tx.rollback();
                }
            } catch (Neo4jException e) {
                throw translate("rollback", e);
            }
        }

        @Override
        public void close() {
            try {
                tx.close();
            } catch (Neo4jException e) {
                logger.warn("Failed to close Neo4j transaction: {}", e.getMessage());
            } finally {
                closeSession(session);
            }
        }
    }
}

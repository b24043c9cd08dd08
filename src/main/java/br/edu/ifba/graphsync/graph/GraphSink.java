package br.edu.ifba.graphsync.graph;

import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;

/**
 * Write and inspection boundary of the property-graph store.
 *
 * <p>Every node and relationship written by an export carries the {@code sync_scope}
 * property, which is how scopes are cleared and counted. Failures are reported as
 * {@link GraphSinkException} subclasses: {@link GraphStoreUnavailableException} when the
 * store cannot be reached and {@link GraphBatchTimeoutException} when a transaction runs
 * past its timeout.</p>
 *
 * <p>Implementations: {@code Neo4jGraphSink}, {@code InMemoryGraphSink}.</p>
 */
public interface GraphSink extends AutoCloseable {

    /** Property holding the stable record id on every node and relationship. */
    String ID_PROPERTY = "id";

    /** Property tagging every written element with the key of the scope that wrote it. */
    String SCOPE_PROPERTY = "sync_scope";

    /**
     * Creates an index on {@code id} for the label if it does not exist yet.
     */
    void createIdIndex(@NotNull String label);

    /**
     * Deletes every node and relationship tagged with the scope, in batches of at most
     * {@code batchSize} elements per transaction. {@link SyncScope#ALL} deletes everything
     * carrying a scope tag.
     *
     * @return number of nodes deleted
     */
    long clearScope(@NotNull SyncScope scope, int batchSize);

    /**
     * Opens a write transaction that the store aborts after {@code timeout}.
     */
    @NotNull
    GraphTransaction beginTransaction(@NotNull Duration timeout);

    long countNodes(@NotNull SyncScope scope);

    long countRelationships(@NotNull SyncScope scope);

    @NotNull
    Optional<GraphNode> findNode(@NotNull String label, @NotNull String id);

    @NotNull
    Optional<GraphRelationship> findRelationship(@NotNull String type, @NotNull String id);

    @Override
    void close();
}

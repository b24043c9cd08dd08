package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

/**
 * One write transaction against the graph store.
 *
 * <p>Nothing is visible to readers until {@link #commit()}. Closing an uncommitted
 * transaction rolls it back.</p>
 */
public interface GraphTransaction extends AutoCloseable {

    /**
     * Creates the node, or replaces the properties of the node with the same label and id.
     */
    void mergeNode(@NotNull NodeWrite node);

    /**
     * Creates the relationship, or replaces the properties of the one with the same type and id.
     *
     * @return false when either endpoint node does not exist; nothing is written then
     */
    boolean mergeRelationship(@NotNull RelationshipWrite relationship);

    void commit();

    void rollback();

    @Override
    void close();
}

package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * A relationship as read back from the graph store.
 *
 * @param type relationship type
 * @param sourceId {@code id} property of the start node
 * @param targetId {@code id} property of the end node
 * @param properties its properties
 */
public record GraphRelationship(
    @NotNull String type,
    @NotNull String sourceId,
    @NotNull String targetId,
    @NotNull Map<String, Object> properties
) {

    public GraphRelationship {
        properties = Map.copyOf(properties);
    }
}

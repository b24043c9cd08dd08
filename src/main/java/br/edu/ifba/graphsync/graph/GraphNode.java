package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Set;

/**
 * A node as read back from the graph store.
 *
 * @param labels all labels of the node
 * @param properties its properties
 */
public record GraphNode(@NotNull Set<String> labels, @NotNull Map<String, Object> properties) {

    public GraphNode {
        labels = Set.copyOf(labels);
        properties = Map.copyOf(properties);
    }
}

package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * A parameterized Cypher statement.
 *
 * @param cypher statement text; values are always passed as parameters
 * @param parameters parameter values by name
 */
public record GraphStatement(@NotNull String cypher, @NotNull Map<String, Object> parameters) {

    public GraphStatement {
        Objects.requireNonNull(cypher, "cypher must not be null");
        parameters = Map.copyOf(parameters);
    }
}

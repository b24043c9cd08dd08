package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node to create or update, keyed by {@code id} within its label.
 *
 * @param label canonical label
 * @param id stable entity id
 * @param properties full property set; replaces whatever the node held before
 */
public record NodeWrite(
    @NotNull String label,
    @NotNull String id,
    @NotNull Map<String, Object> properties
) {

    public NodeWrite {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(id, "id must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(properties, "properties must not be null")));
    }
}

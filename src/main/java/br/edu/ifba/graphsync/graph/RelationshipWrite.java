package br.edu.ifba.graphsync.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A relationship to create or update between two existing nodes, keyed by {@code id}.
 *
 * @param type canonical relationship type
 * @param id stable relationship id
 * @param sourceLabel canonical label of the source node
 * @param sourceId id of the source node
 * @param targetLabel canonical label of the target node
 * @param targetId id of the target node
 * @param properties full property set
 */
public record RelationshipWrite(
    @NotNull String type,
    @NotNull String id,
    @NotNull String sourceLabel,
    @NotNull String sourceId,
    @NotNull String targetLabel,
    @NotNull String targetId,
    @NotNull Map<String, Object> properties
) {

    public RelationshipWrite {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceLabel, "sourceLabel must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetLabel, "targetLabel must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(properties, "properties must not be null")));
    }
}

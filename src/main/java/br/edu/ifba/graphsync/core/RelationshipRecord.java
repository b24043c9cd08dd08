package br.edu.ifba.graphsync.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed relationship between two entity records.
 *
 * <p>Endpoints are entity ids; they are not required to exist, a dangling endpoint is
 * reported when the relationship is exported.</p>
 *
 * @param id stable identifier, unique across relationships
 * @param relationshipType raw type name (e.g. {@code works-at})
 * @param sourceEntityId id of the source entity
 * @param targetEntityId id of the target entity
 * @param attributes semi-structured attributes, never null
 */
public record RelationshipRecord(
    @NotNull String id,
    @NotNull String relationshipType,
    @NotNull String sourceEntityId,
    @NotNull String targetEntityId,
    @NotNull Map<String, Object> attributes
) {

    public RelationshipRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(relationshipType, "relationshipType must not be null");
        Objects.requireNonNull(sourceEntityId, "sourceEntityId must not be null");
        Objects.requireNonNull(targetEntityId, "targetEntityId must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        attributes = attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static RelationshipRecord of(
            @NotNull String id,
            @NotNull String relationshipType,
            @NotNull String sourceEntityId,
            @NotNull String targetEntityId) {
        return new RelationshipRecord(id, relationshipType, sourceEntityId, targetEntityId, Collections.emptyMap());
    }
}

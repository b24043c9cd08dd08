package br.edu.ifba.graphsync.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A relationship record together with the raw entity types of its endpoints.
 *
 * @param record the relationship
 * @param sourceEntityType raw type of the source entity, null when that entity does not exist
 * @param targetEntityType raw type of the target entity, null when that entity does not exist
 * @param sourceFileId source document of the source entity; the relationship belongs to that
 *        document's scope
 */
public record ResolvedRelationship(
    @NotNull RelationshipRecord record,
    @Nullable String sourceEntityType,
    @Nullable String targetEntityType,
    @Nullable String sourceFileId
) {

    public ResolvedRelationship {
        Objects.requireNonNull(record, "record must not be null");
    }

    /** Scope tag written to the graph relationship. */
    @NotNull
    public String scopeTag() {
        return SyncScope.tagFor(sourceFileId);
    }

    public boolean isDangling() {
        return sourceEntityType == null || targetEntityType == null;
    }
}

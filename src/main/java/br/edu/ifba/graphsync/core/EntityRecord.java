package br.edu.ifba.graphsync.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An entity extracted from a source document, as stored in the relational record store.
 *
 * @param id stable identifier, unique across entities
 * @param entityType raw type name as produced upstream (e.g. {@code research_paper})
 * @param displayName human readable name (optional)
 * @param attributes semi-structured attributes, never null
 * @param sourceFileId identifier of the source document (optional)
 */
public record EntityRecord(
    @NotNull String id,
    @NotNull String entityType,
    @Nullable String displayName,
    @NotNull Map<String, Object> attributes,
    @Nullable String sourceFileId
) {

    public EntityRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        attributes = attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates an entity without attributes or source file.
     */
    public static EntityRecord of(@NotNull String id, @NotNull String entityType, @Nullable String displayName) {
        return new EntityRecord(id, entityType, displayName, Collections.emptyMap(), null);
    }
}

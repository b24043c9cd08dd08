package br.edu.ifba.graphsync.source;

import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Read side of the relational record store.
 *
 * <p>All reads are bounded: pages use keyset pagination on {@code id} and never return more
 * than {@code limit} rows. Implementations throw {@link RecordSourceException} on failure.</p>
 */
public interface RecordSource {

    /**
     * Returns the distinct raw entity types present in a scope, sorted.
     */
    @NotNull
    List<String> distinctEntityTypes(@NotNull SyncScope scope);

    /**
     * Reads one page of entity records whose raw type is one of {@code rawTypes}.
     *
     * @param scope the scope to read
     * @param rawTypes raw entity types to include (non-empty)
     * @param afterId exclusive lower bound on {@code id}, or null for the first page
     * @param limit maximum number of records
     * @return records ordered by id
     */
    @NotNull
    List<EntityRecord> readEntities(
        @NotNull SyncScope scope,
        @NotNull Collection<String> rawTypes,
        @Nullable String afterId,
        int limit);

    /**
     * Reads one page of relationship records in a scope, with the raw types of their
     * endpoints resolved. A relationship belongs to the scope of its source entity; its
     * target is looked up across the whole store.
     *
     * @param scope the scope to read
     * @param afterId exclusive lower bound on {@code id}, or null for the first page
     * @param limit maximum number of records
     * @return relationships ordered by id
     */
    @NotNull
    List<ResolvedRelationship> readRelationships(@NotNull SyncScope scope, @Nullable String afterId, int limit);

    long countEntities(@NotNull SyncScope scope);

    long countRelationships(@NotNull SyncScope scope);

    /**
     * Returns up to {@code size} entity records of the scope chosen at random.
     */
    @NotNull
    List<EntityRecord> sampleEntities(@NotNull SyncScope scope, int size);

    /**
     * Returns up to {@code size} relationship records of the scope chosen at random.
     */
    @NotNull
    List<ResolvedRelationship> sampleRelationships(@NotNull SyncScope scope, int size);
}

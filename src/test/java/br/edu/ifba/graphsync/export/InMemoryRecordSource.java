package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.source.RecordSource;
import br.edu.ifba.graphsync.source.RecordSourceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * List-backed record source for tests. Follows the same scope rules as the JDBC repository.
 */
public class InMemoryRecordSource implements RecordSource {

    private final TreeMap<String, EntityRecord> entities = new TreeMap<>();
    private final TreeMap<String, RelationshipRecord> relationships = new TreeMap<>();

    private volatile RecordSourceException relationshipReadFailure;

    public InMemoryRecordSource add(EntityRecord... records) {
        for (EntityRecord record : records) {
            entities.put(record.id(), record);
        }
        return this;
    }

    public InMemoryRecordSource add(RelationshipRecord... records) {
        for (RelationshipRecord record : records) {
            relationships.put(record.id(), record);
        }
        return this;
    }

    public void failRelationshipReads(RecordSourceException failure) {
        this.relationshipReadFailure = failure;
    }

    @Override
    public List<String> distinctEntityTypes(SyncScope scope) {
        return entitiesIn(scope).stream().map(EntityRecord::entityType)
            .collect(Collectors.toCollection(TreeSet::new)).stream().collect(Collectors.toList());
    }

    @Override
    public List<EntityRecord> readEntities(SyncScope scope, Collection<String> rawTypes, String afterId, int limit) {
        return entitiesIn(scope).stream()
            .filter(e -> rawTypes.contains(e.entityType()))
            .filter(e -> afterId == null || e.id().compareTo(afterId) > 0)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ResolvedRelationship> readRelationships(SyncScope scope, String afterId, int limit) {
        RecordSourceException failure = relationshipReadFailure;
        if (failure != null) {
            throw failure;
        }
        return relationshipsIn(scope).stream()
            .filter(r -> afterId == null || r.record().id().compareTo(afterId) > 0)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countEntities(SyncScope scope) {
        return entitiesIn(scope).size();
    }

    @Override
    public long countRelationships(SyncScope scope) {
        return relationshipsIn(scope).size();
    }

    @Override
    public List<EntityRecord> sampleEntities(SyncScope scope, int size) {
        List<EntityRecord> all = new ArrayList<>(entitiesIn(scope));
        Collections.shuffle(all);
        return all.subList(0, Math.min(Math.max(size, 0), all.size()));
    }

    @Override
    public List<ResolvedRelationship> sampleRelationships(SyncScope scope, int size) {
        List<ResolvedRelationship> all = new ArrayList<>(relationshipsIn(scope));
        Collections.shuffle(all);
        return all.subList(0, Math.min(Math.max(size, 0), all.size()));
    }

    private List<EntityRecord> entitiesIn(SyncScope scope) {
        return entities.values().stream()
            .filter(e -> scope.isAll() || Objects.equals(scope.sourceFileId(), e.sourceFileId()))
            .collect(Collectors.toList());
    }

    private List<ResolvedRelationship> relationshipsIn(SyncScope scope) {
        List<ResolvedRelationship> resolved = new ArrayList<>();
        for (RelationshipRecord record : relationships.values()) {
            EntityRecord source = entities.get(record.sourceEntityId());
            if (!scope.isAll() && (source == null || !Objects.equals(scope.sourceFileId(), source.sourceFileId()))) {
                continue;
            }
            EntityRecord target = entities.get(record.targetEntityId());
            resolved.add(new ResolvedRelationship(record,
                source == null ? null : source.entityType(),
                target == null ? null : target.entityType(),
                source == null ? null : source.sourceFileId()));
        }
        return resolved;
    }
}

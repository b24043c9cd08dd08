package br.edu.ifba.graphsync.verify;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.codec.SemiStructuredEncodingException;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RecordKind;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.graph.GraphNode;
import br.edu.ifba.graphsync.graph.GraphPropertyMapper;
import br.edu.ifba.graphsync.graph.GraphRelationship;
import br.edu.ifba.graphsync.graph.GraphSink;
import br.edu.ifba.graphsync.source.RecordSource;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the graph with the relational record store for a scope. Never writes.
 *
 * <p>Both sides go through {@link SemiStructuredCodec#canonicalize(Object)} before they are
 * compared, so {@code 3} and {@code 3.0} are the same value. Expected graph properties are
 * derived with the same {@link GraphPropertyMapper} the export uses.</p>
 */
public class SyncVerifier {

    private static final Logger logger = LoggerFactory.getLogger(SyncVerifier.class);

    private final RecordSource source;
    private final GraphSink sink;
    private final GraphPropertyMapper mapper;
    private final SemiStructuredCodec codec;

    public SyncVerifier(
            @NotNull RecordSource source,
            @NotNull GraphSink sink,
            @NotNull GraphPropertyMapper mapper,
            @NotNull SemiStructuredCodec codec) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Counts records and scope-tagged graph elements.
     */
    @NotNull
    public CountCheck countCheck(@NotNull SyncScope scope) {
        CountCheck check = new CountCheck(
            source.countEntities(scope),
            sink.countNodes(scope),
            source.countRelationships(scope),
            sink.countRelationships(scope));
        logger.debug("Count check of scope {}: {}", scope, check);
        return check;
    }

    /**
     * Compares a random sample of records with their graph elements.
     *
     * @param scope the scope to check
     * @param sampleSize maximum entities and, separately, maximum relationships to sample
     * @return every difference found; empty when the sample matches
     */
    @NotNull
    public List<ContentMismatch> contentCheck(@NotNull SyncScope scope, int sampleSize) {
        return sampleAndCompare(scope, sampleSize).mismatches();
    }

    /**
     * Runs the count check and the content check.
     */
    @NotNull
    public VerificationReport verify(@NotNull SyncScope scope, int sampleSize) {
        CountCheck counts = countCheck(scope);
        SampleResult sample = sampleAndCompare(scope, sampleSize);
        VerificationReport report = new VerificationReport(
            scope, counts, sample.mismatches(), sample.entities(), sample.relationships());
        if (report.inSync()) {
            logger.info("Scope {} in sync ({} nodes, {} relationships, {}+{} sampled)", scope,
                counts.actualNodes(), counts.actualRelationships(), sample.entities(), sample.relationships());
        } else {
            logger.warn("Scope {} out of sync: counts {} , {} content mismatch(es)",
                scope, counts, report.mismatches().size());
        }
        return report;
    }

    private SampleResult sampleAndCompare(SyncScope scope, int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must not be negative");
        }
        List<ContentMismatch> mismatches = new ArrayList<>();
        List<EntityRecord> entities = source.sampleEntities(scope, sampleSize);
        for (EntityRecord entity : entities) {
            compareEntity(entity, mismatches);
        }
        List<ResolvedRelationship> relationships = source.sampleRelationships(scope, sampleSize);
        for (ResolvedRelationship relationship : relationships) {
            compareRelationship(relationship, mismatches);
        }
        return new SampleResult(mismatches, entities.size(), relationships.size());
    }

    private void compareEntity(EntityRecord entity, List<ContentMismatch> mismatches) {
        String label = mapper.normalizer().label(entity.entityType());
        Map<String, Object> expected;
        try {
            expected = mapper.nodeProperties(entity);
        } catch (SemiStructuredEncodingException e) {
            mismatches.add(ContentMismatch.of(RecordKind.NODE, entity.id(), MismatchProblem.UNENCODABLE,
                e.getPath(), e.getMessage()));
            return;
        }

        Optional<GraphNode> node = sink.findNode(label, entity.id());
        if (node.isEmpty()) {
            mismatches.add(ContentMismatch.of(RecordKind.NODE, entity.id(), MismatchProblem.MISSING, label, null));
            return;
        }
        if (!node.get().labels().equals(Set.of(label))) {
            mismatches.add(ContentMismatch.of(RecordKind.NODE, entity.id(), MismatchProblem.LABEL,
                label, new TreeSet<>(node.get().labels()).toString()));
        }
        compareProperties(RecordKind.NODE, entity.id(), expected, node.get().properties(), mismatches);
    }

    private void compareRelationship(ResolvedRelationship resolved, List<ContentMismatch> mismatches) {
        RelationshipRecord record = resolved.record();
        if (resolved.sourceEntityType() == null) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.ENDPOINT,
                record.sourceEntityId(), null));
            return;
        }
        if (resolved.targetEntityType() == null) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.ENDPOINT,
                record.targetEntityId(), null));
            return;
        }

        String type = mapper.normalizer().relationshipType(record.relationshipType());
        Map<String, Object> expected;
        try {
            expected = mapper.relationshipProperties(resolved);
        } catch (SemiStructuredEncodingException e) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.UNENCODABLE,
                e.getPath(), e.getMessage()));
            return;
        }

        Optional<GraphRelationship> found = sink.findRelationship(type, record.id());
        if (found.isEmpty()) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.MISSING, type, null));
            return;
        }
        GraphRelationship relationship = found.get();
        if (!type.equals(relationship.type())) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.TYPE,
                type, relationship.type()));
        }
        String expectedEndpoints = record.sourceEntityId() + "->" + record.targetEntityId();
        String actualEndpoints = relationship.sourceId() + "->" + relationship.targetId();
        if (!expectedEndpoints.equals(actualEndpoints)) {
            mismatches.add(ContentMismatch.of(RecordKind.RELATIONSHIP, record.id(), MismatchProblem.ENDPOINT,
                expectedEndpoints, actualEndpoints));
        }
        compareProperties(RecordKind.RELATIONSHIP, record.id(), expected, relationship.properties(), mismatches);
    }

    private void compareProperties(RecordKind kind, String recordId, Map<String, Object> expectedRaw,
                                   Map<String, Object> actualRaw, List<ContentMismatch> mismatches) {
        Map<?, ?> expected = (Map<?, ?>) codec.canonicalize(expectedRaw);
        Map<?, ?> actual = (Map<?, ?>) codec.canonicalize(actualRaw);
        Set<String> keys = new TreeSet<>();
        expected.keySet().forEach(key -> keys.add(String.valueOf(key)));
        actual.keySet().forEach(key -> keys.add(String.valueOf(key)));
        for (String key : keys) {
            Object expectedValue = expected.get(key);
            Object actualValue = actual.get(key);
            if (!Objects.equals(expectedValue, actualValue)) {
                mismatches.add(new ContentMismatch(kind, recordId, MismatchProblem.PROPERTY, key, expectedValue, actualValue));
            }
        }
    }

    private record SampleResult(List<ContentMismatch> mismatches, int entities, int relationships) {
    }
}

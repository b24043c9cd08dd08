package br.edu.ifba.graphsync.graph;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.naming.IdentifierNormalizer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps relational records to graph writes.
 *
 * <p>Graph properties cannot hold maps or mixed-type lists, so attribute values are stored
 * natively when they are scalars or lists of one scalar kind, and as JSON text otherwise.
 * Null values are omitted, matching how the graph store treats {@code SET n = $props}.
 * The verifier applies the same mapping to the relational side before comparing.</p>
 */
public final class GraphPropertyMapper {

    private static final Logger logger = LoggerFactory.getLogger(GraphPropertyMapper.class);

    public static final String NAME_PROPERTY = "name";
    public static final String ENTITY_TYPE_PROPERTY = "entity_type";
    public static final String SOURCE_FILE_PROPERTY = "source_file_id";
    public static final String RELATIONSHIP_TYPE_PROPERTY = "relationship_type";

    private static final Set<String> NODE_SYSTEM_KEYS = Set.of(
        GraphSink.ID_PROPERTY, NAME_PROPERTY, ENTITY_TYPE_PROPERTY, SOURCE_FILE_PROPERTY, GraphSink.SCOPE_PROPERTY);

    private static final Set<String> RELATIONSHIP_SYSTEM_KEYS = Set.of(
        GraphSink.ID_PROPERTY, RELATIONSHIP_TYPE_PROPERTY, GraphSink.SCOPE_PROPERTY);

    private final SemiStructuredCodec codec;
    private final IdentifierNormalizer normalizer;

    public GraphPropertyMapper(@NotNull SemiStructuredCodec codec, @NotNull IdentifierNormalizer normalizer) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    @NotNull
    public IdentifierNormalizer normalizer() {
        return normalizer;
    }

    /**
     * Builds the node write for an entity.
     *
     * @throws br.edu.ifba.graphsync.codec.SemiStructuredEncodingException if an attribute
     *         value cannot be encoded
     */
    @NotNull
    public NodeWrite toNodeWrite(@NotNull EntityRecord entity) {
        return new NodeWrite(normalizer.label(entity.entityType()), entity.id(), nodeProperties(entity));
    }

    /**
     * Builds the relationship write for a resolved relationship.
     *
     * @throws IllegalStateException if either endpoint type is unknown
     */
    @NotNull
    public RelationshipWrite toRelationshipWrite(@NotNull ResolvedRelationship resolved) {
        if (resolved.isDangling()) {
            throw new IllegalStateException("Relationship " + resolved.record().id() + " has a dangling endpoint");
        }
        RelationshipRecord record = resolved.record();
        return new RelationshipWrite(
            normalizer.relationshipType(record.relationshipType()),
            record.id(),
            normalizer.label(resolved.sourceEntityType()),
            record.sourceEntityId(),
            normalizer.label(resolved.targetEntityType()),
            record.targetEntityId(),
            relationshipProperties(resolved));
    }

    /**
     * Graph properties of an entity. The scope tag comes from the entity's own source
     * document, so exporting through different scopes writes the same properties.
     */
    @NotNull
    public Map<String, Object> nodeProperties(@NotNull EntityRecord entity) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(GraphSink.ID_PROPERTY, entity.id());
        putIfPresent(properties, NAME_PROPERTY, entity.displayName());
        properties.put(ENTITY_TYPE_PROPERTY, entity.entityType());
        putIfPresent(properties, SOURCE_FILE_PROPERTY, entity.sourceFileId());
        properties.put(GraphSink.SCOPE_PROPERTY, SyncScope.tagFor(entity.sourceFileId()));
        putAttributes(properties, entity.attributes(), NODE_SYSTEM_KEYS, entity.id());
        return properties;
    }

    @NotNull
    public Map<String, Object> relationshipProperties(@NotNull ResolvedRelationship resolved) {
        RelationshipRecord record = resolved.record();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(GraphSink.ID_PROPERTY, record.id());
        properties.put(RELATIONSHIP_TYPE_PROPERTY, record.relationshipType());
        properties.put(GraphSink.SCOPE_PROPERTY, resolved.scopeTag());
        putAttributes(properties, record.attributes(), RELATIONSHIP_SYSTEM_KEYS, record.id());
        return properties;
    }

    private void putAttributes(Map<String, Object> properties, Map<String, Object> attributes,
                               Set<String> systemKeys, String recordId) {
        Map<String, Object> encoded = codec.encodeAttributes(attributes);
        for (Map.Entry<String, Object> entry : encoded.entrySet()) {
            if (systemKeys.contains(entry.getKey())) {
                logger.warn("Dropping attribute '{}' of record {}: it collides with a system property",
                    entry.getKey(), recordId);
                continue;
            }
            Object value = toPropertyValue(entry.getValue());
            if (value != null) {
                properties.put(entry.getKey(), value);
            }
        }
    }

    /**
     * Converts an encoded attribute value into a value the graph store can hold.
     *
     * @param encoded a value produced by {@link SemiStructuredCodec#encode(Object)}
     * @return a scalar, a homogeneous scalar list, JSON text, or null
     */
    @Nullable
    public Object toPropertyValue(@Nullable Object encoded) {
        if (encoded == null) {
            return null;
        }
        Object scalar = toScalar(encoded);
        if (scalar != null) {
            return scalar;
        }
        if (encoded instanceof List<?> list) {
            List<Object> values = new ArrayList<>(list.size());
            Class<?> kind = null;
            for (Object element : list) {
                Object value = element == null ? null : toScalar(element);
                if (value == null || (kind != null && kind != value.getClass())) {
                    return codec.toJson(encoded);
                }
                kind = value.getClass();
                values.add(value);
            }
            return values;
        }
        return codec.toJson(encoded);
    }

    @Nullable
    private static Object toScalar(Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> properties, String key, @Nullable Object value) {
        if (value != null) {
            properties.put(key, value);
        }
    }
}

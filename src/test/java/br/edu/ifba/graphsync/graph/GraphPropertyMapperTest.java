package br.edu.ifba.graphsync.graph;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.codec.SemiStructuredEncodingException;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.naming.IdentifierNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphPropertyMapperTest {

    private GraphPropertyMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new GraphPropertyMapper(new SemiStructuredCodec(), IdentifierNormalizer.canonical());
    }

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        @DisplayName("should derive the label and write system properties")
        void testNodeWrite() {
            EntityRecord entity = new EntityRecord("e1", "research_paper", "Attention", Map.of("year", 2017), "doc-1");

            NodeWrite write = mapper.toNodeWrite(entity);

            assertEquals("ResearchPaper", write.label());
            assertEquals("e1", write.id());
            assertEquals(Map.of(
                "id", "e1",
                "name", "Attention",
                "entity_type", "research_paper",
                "source_file_id", "doc-1",
                "sync_scope", "file:doc-1",
                "year", 2017L), write.properties());
        }

        @Test
        @DisplayName("should omit absent optional fields and null attributes")
        void testOmitsNulls() {
            Map<String, Object> attributes = new HashMap<>();
            attributes.put("missing", null);
            Map<String, Object> properties = mapper.nodeProperties(
                new EntityRecord("e1", "Person", null, attributes, null));

            assertEquals(Map.of("id", "e1", "entity_type", "Person", "sync_scope", "all"), properties);
        }

        @Test
        @DisplayName("should drop attributes that collide with system properties")
        void testCollisions() {
            Map<String, Object> properties = mapper.nodeProperties(
                new EntityRecord("e1", "Person", "Ada", Map.of("id", "spoofed", "sync_scope", "x", "age", 36), null));

            assertEquals("e1", properties.get("id"));
            assertEquals("all", properties.get("sync_scope"));
            assertEquals(36L, properties.get("age"));
        }

        @Test
        @DisplayName("should propagate encoding failures")
        void testEncodingFailure() {
            EntityRecord entity = new EntityRecord("e1", "Person", null, Map.of("bad", new Object()), null);
            assertThrows(SemiStructuredEncodingException.class, () -> mapper.toNodeWrite(entity));
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @Test
        @DisplayName("should derive the type and endpoint labels")
        void testRelationshipWrite() {
            ResolvedRelationship resolved = new ResolvedRelationship(
                new RelationshipRecord("r1", "works-at", "e1", "e2", Map.of("since", 2020)), "person", "ORGANIZATION", null);

            RelationshipWrite write = mapper.toRelationshipWrite(resolved);

            assertEquals("WORKS_AT", write.type());
            assertEquals("Person", write.sourceLabel());
            assertEquals("Organization", write.targetLabel());
            assertEquals("e1", write.sourceId());
            assertEquals("e2", write.targetId());
            assertEquals(Map.of("id", "r1", "relationship_type", "works-at", "sync_scope", "all", "since", 2020L),
                write.properties());
        }

        @Test
        @DisplayName("should refuse dangling relationships")
        void testDangling() {
            ResolvedRelationship resolved = new ResolvedRelationship(
                RelationshipRecord.of("r1", "cites", "e1", "gone"), "Paper", null, "doc-1");
            assertThrows(IllegalStateException.class, () -> mapper.toRelationshipWrite(resolved));
        }
    }

    @Nested
    @DisplayName("Scope tag")
    class ScopeTag {

        @Test
        @DisplayName("should tag a node with its own source document")
        void testNodeTagFollowsRecord() {
            Map<String, Object> properties = mapper.nodeProperties(
                new EntityRecord("e5", "ML-Model", null, Map.of(), "doc-2"));

            assertEquals("file:doc-2", properties.get("sync_scope"));
            assertTrue(SyncScope.ALL.covers((String) properties.get("sync_scope")));
            assertTrue(SyncScope.file("doc-2").covers((String) properties.get("sync_scope")));
            assertFalse(SyncScope.file("doc-1").covers((String) properties.get("sync_scope")));
        }

        @Test
        @DisplayName("should tag a relationship with its source entity's document")
        void testRelationshipTagFollowsSourceEntity() {
            ResolvedRelationship resolved = new ResolvedRelationship(
                RelationshipRecord.of("r3", "collaborates with", "e1", "e5"), "Person", "ML-Model", "doc-1");

            assertEquals("file:doc-1", mapper.toRelationshipWrite(resolved).properties().get("sync_scope"));
        }
    }

    @Nested
    @DisplayName("Property values")
    class PropertyValues {

        @Test
        @DisplayName("should keep scalars and homogeneous scalar lists native")
        void testNativeValues() {
            assertEquals("x", mapper.toPropertyValue("x"));
            assertEquals(true, mapper.toPropertyValue(true));
            assertEquals(List.of(1L, 2L), mapper.toPropertyValue(List.of(1L, 2L)));
            assertEquals(List.of(), mapper.toPropertyValue(List.of()));
            assertNull(mapper.toPropertyValue(null));
        }

        @Test
        @DisplayName("should store maps and mixed lists as JSON text")
        void testJsonValues() {
            assertEquals("{\"name\":\"KDD\"}", mapper.toPropertyValue(Map.of("name", "KDD")));
            assertEquals("[1,2.5]", mapper.toPropertyValue(List.of(1L, 2.5d)));
            assertEquals("[\"a\",null]", mapper.toPropertyValue(Arrays.asList("a", null)));
        }

        @Test
        @DisplayName("should fit big numbers into graph property types")
        void testBigNumbers() {
            assertEquals(5L, mapper.toPropertyValue(BigInteger.valueOf(5)));
            assertEquals("123456789012345678901234567890",
                mapper.toPropertyValue(new BigInteger("123456789012345678901234567890")));
            assertEquals(0.25d, mapper.toPropertyValue(new BigDecimal("0.25")));
            assertFalse(mapper.toPropertyValue(new BigDecimal("0.25")) instanceof BigDecimal);
        }
    }
}

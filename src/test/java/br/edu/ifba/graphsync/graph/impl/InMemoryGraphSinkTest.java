package br.edu.ifba.graphsync.graph.impl;

import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.graph.GraphBatchTimeoutException;
import br.edu.ifba.graphsync.graph.GraphRelationship;
import br.edu.ifba.graphsync.graph.GraphStoreUnavailableException;
import br.edu.ifba.graphsync.graph.GraphTransaction;
import br.edu.ifba.graphsync.graph.NodeWrite;
import br.edu.ifba.graphsync.graph.RelationshipWrite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryGraphSinkTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryGraphSink sink;

    @BeforeEach
    void setUp() {
        sink = new InMemoryGraphSink();
    }

    private static NodeWrite node(String label, String id, String scopeKey) {
        return new NodeWrite(label, id, Map.of("id", id, "sync_scope", scopeKey));
    }

    private static RelationshipWrite rel(String id, String sourceLabel, String sourceId, String targetLabel,
                                         String targetId, String scopeKey) {
        return new RelationshipWrite("LINKS", id, sourceLabel, sourceId, targetLabel, targetId,
            Map.of("id", id, "sync_scope", scopeKey));
    }

    private void commit(NodeWrite... nodes) {
        try (GraphTransaction tx = sink.beginTransaction(TIMEOUT)) {
            for (NodeWrite node : nodes) {
                tx.mergeNode(node);
            }
            tx.commit();
        }
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("should make writes visible only after commit")
        void testCommitVisibility() {
            try (GraphTransaction tx = sink.beginTransaction(TIMEOUT)) {
                tx.mergeNode(node("Person", "e1", "all"));
                assertTrue(sink.findNode("Person", "e1").isEmpty());
                tx.commit();
            }
            assertTrue(sink.findNode("Person", "e1").isPresent());
            assertEquals(Set.of("Person"), sink.findNode("Person", "e1").get().labels());
        }

        @Test
        @DisplayName("should discard writes when closed without commit")
        void testCloseRollsBack() {
            try (GraphTransaction tx = sink.beginTransaction(TIMEOUT)) {
                tx.mergeNode(node("Person", "e1", "all"));
            }
            assertEquals(0, sink.countNodes(SyncScope.ALL));
        }

        @Test
        @DisplayName("should replace properties when merging an existing node")
        void testMergeReplaces() {
            commit(new NodeWrite("Person", "e1", Map.of("id", "e1", "sync_scope", "all", "age", 30L)));
            commit(node("Person", "e1", "all"));

            assertEquals(1, sink.countNodes(SyncScope.ALL));
            assertFalse(sink.findNode("Person", "e1").get().properties().containsKey("age"));
        }

        @Test
        @DisplayName("should refuse relationships whose endpoints do not exist")
        void testRelationshipEndpoints() {
            commit(node("Person", "e1", "all"));
            try (GraphTransaction tx = sink.beginTransaction(TIMEOUT)) {
                assertFalse(tx.mergeRelationship(rel("r1", "Person", "e1", "Org", "e2", "all")));
                tx.mergeNode(node("Org", "e2", "all"));
                assertTrue(tx.mergeRelationship(rel("r2", "Person", "e1", "Org", "e2", "all")));
                tx.commit();
            }

            assertTrue(sink.findRelationship("LINKS", "r1").isEmpty());
            GraphRelationship r2 = sink.findRelationship("LINKS", "r2").orElseThrow();
            assertEquals("e1", r2.sourceId());
            assertEquals("e2", r2.targetId());
        }

        @Test
        @DisplayName("should fail a transaction that outlives its timeout")
        void testTimeout() throws Exception {
            try (GraphTransaction tx = sink.beginTransaction(Duration.ofMillis(1))) {
                Thread.sleep(20);
                assertThrows(GraphBatchTimeoutException.class, () -> tx.mergeNode(node("Person", "e1", "all")));
            }
            assertEquals(0, sink.countNodes(SyncScope.ALL));
        }

        @Test
        @DisplayName("should reject a second commit")
        void testClosedTransaction() {
            GraphTransaction tx = sink.beginTransaction(TIMEOUT);
            tx.commit();
            assertThrows(IllegalStateException.class, () -> tx.mergeNode(node("Person", "e1", "all")));
        }
    }

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        @BeforeEach
        void seed() {
            commit(node("Person", "a1", "file:a"), node("Person", "a2", "file:a"), node("Person", "b1", "file:b"));
            try (GraphTransaction tx = sink.beginTransaction(TIMEOUT)) {
                tx.mergeRelationship(rel("ra", "Person", "a1", "Person", "a2", "file:a"));
                tx.mergeRelationship(rel("rb", "Person", "b1", "Person", "a1", "file:b"));
                tx.commit();
            }
        }

        @Test
        @DisplayName("should count elements per scope tag")
        void testCounts() {
            assertEquals(2, sink.countNodes(SyncScope.file("a")));
            assertEquals(3, sink.countNodes(SyncScope.ALL));
            assertEquals(1, sink.countRelationships(SyncScope.file("b")));
            assertEquals(2, sink.countRelationships(SyncScope.ALL));
        }

        @Test
        @DisplayName("should clear one scope and detach relationships of deleted nodes")
        void testClearScope() {
            assertEquals(2, sink.clearScope(SyncScope.file("a"), 100));

            assertEquals(0, sink.countNodes(SyncScope.file("a")));
            assertEquals(1, sink.countNodes(SyncScope.file("b")));
            assertEquals(0, sink.countRelationships(SyncScope.ALL), "rb pointed at a deleted node");
        }

        @Test
        @DisplayName("should clear every tagged element for the full scope")
        void testClearAll() {
            assertEquals(3, sink.clearScope(SyncScope.ALL, 1));
            assertTrue(sink.labels().isEmpty());
            assertTrue(sink.relationshipTypes().isEmpty());
        }

        @Test
        @DisplayName("should simulate drift")
        void testDriftHelpers() {
            sink.putNodeProperty("Person", "a1", "name", "changed");
            assertEquals("changed", sink.findNode("Person", "a1").get().properties().get("name"));

            sink.deleteNode("Person", "a2");
            assertTrue(sink.findNode("Person", "a2").isEmpty());
            assertTrue(sink.findRelationship("LINKS", "ra").isEmpty());
        }
    }

    @Test
    @DisplayName("should track indexed labels")
    void testIndexes() {
        sink.createIdIndex("Person");
        sink.createIdIndex("Person");
        assertEquals(Set.of("Person"), sink.indexedLabels());
    }

    @Test
    @DisplayName("should fail every operation while offline")
    void testUnavailable() {
        sink.setAvailable(false);
        assertThrows(GraphStoreUnavailableException.class, () -> sink.countNodes(SyncScope.ALL));
        assertThrows(GraphStoreUnavailableException.class, () -> sink.beginTransaction(TIMEOUT));
        sink.setAvailable(true);
        assertEquals(0, sink.countNodes(SyncScope.ALL));
    }
}

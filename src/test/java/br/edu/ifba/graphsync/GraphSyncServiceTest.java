package br.edu.ifba.graphsync;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.config.GraphSyncConfig;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RelationshipRecord;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.export.CancellationToken;
import br.edu.ifba.graphsync.export.GraphExportOrchestrator;
import br.edu.ifba.graphsync.export.SyncRunRecord;
import br.edu.ifba.graphsync.graph.GraphPropertyMapper;
import br.edu.ifba.graphsync.graph.GraphTransaction;
import br.edu.ifba.graphsync.graph.NodeWrite;
import br.edu.ifba.graphsync.graph.impl.InMemoryGraphSink;
import br.edu.ifba.graphsync.source.impl.JdbcConnectionProvider;
import br.edu.ifba.graphsync.source.impl.JdbcRecordRepository;
import br.edu.ifba.graphsync.verify.SyncVerifier;
import br.edu.ifba.graphsync.verify.VerificationReport;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs export and verification end to end: SQLite record store, in-memory graph.
 */
class GraphSyncServiceTest {

    @TempDir
    Path tempDir;

    private JdbcRecordRepository repository;
    private InMemoryGraphSink sink;
    private GraphSyncService service;

    @BeforeEach
    void setUp() {
        GraphSyncConfig config = new SmallRyeConfigBuilder()
            .withMapping(GraphSyncConfig.class)
            .withSources(new PropertiesConfigSource(Map.of(
                "graphsync.dialect", "sqlite",
                "graphsync.batch-size", "2",
                "graphsync.verify.sample-size", "10"), "test", 100))
            .build()
            .getConfigMapping(GraphSyncConfig.class);

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("sync.db"));
        SemiStructuredCodec codec = new SemiStructuredCodec();
        repository = new JdbcRecordRepository(
            new JdbcConnectionProvider(dataSource), config.sqlDialect(), codec, config.readTimeoutSeconds());
        repository.initialize();

        sink = new InMemoryGraphSink();
        GraphPropertyMapper mapper = new GraphPropertyMapper(codec, config.normalizer());
        service = new GraphSyncService(
            new GraphExportOrchestrator(repository, sink, mapper, config.exportSettings()),
            new SyncVerifier(repository, sink, mapper, codec),
            config);

        repository.insertEntities(List.of(
            new EntityRecord("e1", "Person", "Alice", Map.of("age", 30, "skills", List.of("sql", "cypher")), "doc-1"),
            new EntityRecord("e2", "person", "Bob", Map.of("meta", Map.of("verified", true)), "doc-1"),
            new EntityRecord("e3", "research_paper", "Graphs at Scale", Map.of("year", 2021), "doc-1"),
            new EntityRecord("e4", "Research-Paper", "Sync Patterns", Map.of("mixed", List.of(1, "two")), "doc-2"),
            new EntityRecord("e5", "ML-Model", "Ranker", Map.of("weights", List.of(0.5, 1.5)), "doc-2")));
        repository.insertRelationships(List.of(
            new RelationshipRecord("r1", "works-at", "e1", "e3", Map.of("since", 2020)),
            RelationshipRecord.of("r2", "WORKS_AT", "e2", "e4"),
            RelationshipRecord.of("r3", "collaborates with", "e1", "e5")));
    }

    @Nested
    @DisplayName("Export")
    class Export {

        @Test
        @DisplayName("should converge raw types onto canonical labels and relationship types")
        void testCanonicalNames() {
            SyncRunRecord run = service.export(SyncScope.ALL);

            assertTrue(run.isComplete());
            assertEquals(5, run.nodesSucceeded());
            assertEquals(3, run.relationshipsSucceeded());
            assertEquals(Set.of("Person", "ResearchPaper", "MlModel"), run.labels());
            assertEquals(Set.of("WORKS_AT", "COLLABORATES_WITH"), run.relationshipTypes());
            assertEquals(Set.of("Person", "ResearchPaper", "MlModel"), sink.labels());
            assertEquals(Set.of("WORKS_AT", "COLLABORATES_WITH"), sink.relationshipTypes());
        }

        @Test
        @DisplayName("should store nested attributes as JSON text and flat lists natively")
        void testPropertyValues() {
            service.export(SyncScope.ALL);

            Map<String, Object> bob = sink.findNode("Person", "e2").orElseThrow().properties();
            assertEquals("{\"verified\":true}", bob.get("meta"));
            Map<String, Object> model = sink.findNode("MlModel", "e5").orElseThrow().properties();
            assertEquals(List.of(0.5, 1.5), model.get("weights"));
            assertEquals("ML-Model", model.get("entity_type"));
        }

        @Test
        @DisplayName("should not write anything when cancelled up front")
        void testCancelled() {
            CancellationToken token = new CancellationToken();
            token.cancel();

            SyncRunRecord run = service.export(SyncScope.ALL, 10, false, token);

            assertTrue(run.cancelled());
            assertTrue(sink.labels().isEmpty());
        }
    }

    @Nested
    @DisplayName("Verify")
    class Verify {

        @Test
        @DisplayName("should report the exported store as in sync")
        void testInSync() {
            service.export(SyncScope.ALL);

            VerificationReport report = service.verify(SyncScope.ALL);

            assertTrue(report.inSync(), () -> "unexpected mismatches: " + report.mismatches());
            assertEquals(5, report.sampledEntities());
            assertEquals(3, report.sampledRelationships());
        }

        @Test
        @DisplayName("should report a file scope as in sync after exporting it with a clear")
        void testFileScope() {
            SyncScope scope = SyncScope.file("doc-2");
            service.export(scope, 1, true, null);

            VerificationReport report = service.verify(scope, 10);

            assertTrue(report.inSync(), () -> "unexpected mismatches: " + report.mismatches());
            assertEquals(2, report.countCheck().actualNodes());
            assertEquals(0, report.countCheck().expectedRelationships());
        }

        @Test
        @DisplayName("should report the whole store as in sync after exporting file by file")
        void testAllAfterFileExports() {
            service.export(SyncScope.file("doc-2"));
            service.export(SyncScope.file("doc-1"));

            VerificationReport report = service.verify(SyncScope.ALL);

            assertTrue(report.inSync(), () -> "unexpected mismatches: " + report.mismatches());
            assertEquals(5, report.countCheck().actualNodes());
            assertEquals(3, report.countCheck().actualRelationships());
        }

        @Test
        @DisplayName("should report a file as in sync after re-exporting another file")
        void testFileAfterFullExport() {
            service.export(SyncScope.ALL);
            service.export(SyncScope.file("doc-1"));

            VerificationReport report = service.verify(SyncScope.file("doc-2"));

            assertTrue(report.inSync(), () -> "unexpected mismatches: " + report.mismatches());
            assertEquals(2, report.countCheck().expectedNodes());
            assertEquals(2, report.countCheck().actualNodes());
        }

        @Test
        @DisplayName("should clear a file exported through the whole store")
        void testClearFileAfterFullExport() {
            service.export(SyncScope.ALL);
            try (GraphTransaction tx = sink.beginTransaction(Duration.ofSeconds(5))) {
                tx.mergeNode(new NodeWrite("Person", "gone", Map.of("id", "gone", "sync_scope", "file:doc-1")));
                tx.commit();
            }

            service.export(SyncScope.file("doc-1"), 10, true, null);

            assertFalse(sink.findNode("Person", "gone").isPresent());
            assertEquals(3, sink.countNodes(SyncScope.file("doc-1")));
            assertEquals(2, sink.countNodes(SyncScope.file("doc-2")));
            assertTrue(service.verify(SyncScope.ALL).inSync());
        }

        @Test
        @DisplayName("should detect drift introduced after the export")
        void testDrift() {
            service.export(SyncScope.ALL);
            sink.putNodeProperty("ResearchPaper", "e3", "year", 1999);

            VerificationReport report = service.verify(SyncScope.ALL, 10);

            assertFalse(report.inSync());
            assertEquals(1, report.mismatches().size());
            assertEquals("year", report.mismatches().get(0).key());
        }
    }

    @Test
    @DisplayName("should expose the configured normalizer")
    void testNormalize() {
        assertEquals("ResearchPaper", service.normalizeLabel("research paper"));
        assertEquals("COLLABORATES_WITH", service.normalizeRelationshipType("collaborates-with"));
        assertEquals("Entity", service.normalizeLabel("   "));
    }
}

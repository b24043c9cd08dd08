package br.edu.ifba.graphsync.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IdentifierNormalizerTest {

    private static final List<String> SAMPLES = List.of(
        "Person", "person", "research_paper", "Research-Paper", "research paper", "ResearchPaper",
        "ML-Model", "MLModel", "ml_model", "HTTPServer", "XMLHttpRequest", "x-ray", "a-b-c", "A B",
        "works-at", "WORKS_AT", "worksAt", "collaborates with", "hasURL", "version2Beta",
        "3d-model", "2nd order", "123", "", "   ", "---", "__init__");

    @Nested
    @DisplayName("Labels")
    class Labels {

        @Test
        @DisplayName("should converge spelling variants on one PascalCase label")
        void testConvergence() {
            assertEquals(Set.of("ResearchPaper"), labelsOf("research_paper", "Research-Paper", "research paper",
                "ResearchPaper", "RESEARCH_PAPER"));
            assertEquals(Set.of("MlModel"), labelsOf("ML-Model", "MLModel", "ml_model", "MlModel", "ml model"));
            assertEquals(Set.of("Person"), labelsOf("Person", "person", "PERSON", " person "));
        }

        @Test
        @DisplayName("should split acronym runs before a capitalized word")
        void testAcronymBoundary() {
            assertEquals("HttpServer", IdentifierNormalizer.normalizeLabel("HTTPServer"));
            assertEquals("XmlHttpRequest", IdentifierNormalizer.normalizeLabel("XMLHttpRequest"));
        }

        @Test
        @DisplayName("should fall back to Entity for empty input and prefix leading digits")
        void testSentinel() {
            assertEquals("Entity", IdentifierNormalizer.normalizeLabel(null));
            assertEquals("Entity", IdentifierNormalizer.normalizeLabel(""));
            assertEquals("Entity", IdentifierNormalizer.normalizeLabel(" -_- "));
            assertEquals("Entity123", IdentifierNormalizer.normalizeLabel("123"));
            assertEquals("Entity3dModel", IdentifierNormalizer.normalizeLabel("3d-model"));
        }

        @Test
        @DisplayName("should join adjacent single letters")
        void testSingleLetters() {
            assertEquals("Abc", IdentifierNormalizer.normalizeLabel("a-b-c"));
            assertEquals("XRay", IdentifierNormalizer.normalizeLabel("x-ray"));
            assertEquals(List.of("x", "ray"), IdentifierNormalizer.tokens("x-ray"));
        }

        @Test
        @DisplayName("should be idempotent")
        void testIdempotent() {
            for (String raw : SAMPLES) {
                String once = IdentifierNormalizer.normalizeLabel(raw);
                assertEquals(once, IdentifierNormalizer.normalizeLabel(once), "label of '" + raw + "'");
            }
        }

        @Test
        @DisplayName("should only produce identifier characters")
        void testValidIdentifiers() {
            for (String raw : SAMPLES) {
                String label = IdentifierNormalizer.normalizeLabel(raw);
                assertEquals(true, label.matches("[A-Za-z][A-Za-z0-9]*"), label);
            }
        }
    }

    @Nested
    @DisplayName("Relationship types")
    class RelationshipTypes {

        @Test
        @DisplayName("should converge spelling variants on one UPPER_SNAKE_CASE type")
        void testConvergence() {
            assertEquals(Set.of("WORKS_AT"), typesOf("works-at", "WORKS_AT", "worksAt", "Works At", "works_at"));
            assertEquals("COLLABORATES_WITH", IdentifierNormalizer.normalizeRelationshipType("collaborates with"));
            assertEquals("HAS_URL", IdentifierNormalizer.normalizeRelationshipType("hasURL"));
        }

        @ParameterizedTest
        @CsvSource({
            "works-at, WORKS_AT",
            "worksAt, WORKS_AT",
            "collaborates with, COLLABORATES_WITH",
            "hasURL, HAS_URL"
        })
        @DisplayName("should map raw relationship names to their canonical type")
        void testCanonicalType(String raw, String expected) {
            assertEquals(expected, IdentifierNormalizer.normalizeRelationshipType(raw));
        }

        @Test
        @DisplayName("should fall back to RELATED_TO and prefix leading digits")
        void testSentinel() {
            assertEquals("RELATED_TO", IdentifierNormalizer.normalizeRelationshipType(null));
            assertEquals("RELATED_TO", IdentifierNormalizer.normalizeRelationshipType("  "));
            assertEquals("RELATED_TO_2ND_ORDER", IdentifierNormalizer.normalizeRelationshipType("2nd order"));
        }

        @Test
        @DisplayName("should be idempotent")
        void testIdempotent() {
            for (String raw : SAMPLES) {
                String once = IdentifierNormalizer.normalizeRelationshipType(raw);
                assertEquals(once, IdentifierNormalizer.normalizeRelationshipType(once), "type of '" + raw + "'");
            }
        }

        @Test
        @DisplayName("should only produce identifier characters")
        void testValidIdentifiers() {
            for (String raw : SAMPLES) {
                String type = IdentifierNormalizer.normalizeRelationshipType(raw);
                assertEquals(true, type.matches("[A-Z][A-Z0-9_]*"), type);
            }
        }
    }

    @Nested
    @DisplayName("Acronym-preserving mode")
    class PreservingAcronyms {

        private final IdentifierNormalizer normalizer = IdentifierNormalizer.preservingAcronyms();

        @Test
        @DisplayName("should keep short uppercase tokens")
        void testKeepsAcronyms() {
            assertEquals("MLModel", normalizer.label("ML-Model"));
            assertEquals("MLModel", normalizer.label("MLModel"));
            assertEquals("HTTPServer", normalizer.label("HTTPServer"));
            assertEquals("Database", normalizer.label("DATABASE"));
        }

        @Test
        @DisplayName("should not change relationship types")
        void testRelationshipTypes() {
            assertEquals("WORKS_AT", normalizer.relationshipType("works-at"));
        }

        @Test
        @DisplayName("should be deterministic")
        void testDeterministic() {
            for (String raw : SAMPLES) {
                assertEquals(normalizer.label(raw), normalizer.label(raw));
            }
        }
    }

    private static Set<String> labelsOf(String... raws) {
        return List.of(raws).stream().map(IdentifierNormalizer::normalizeLabel).collect(Collectors.toSet());
    }

    private static Set<String> typesOf(String... raws) {
        return List.of(raws).stream().map(IdentifierNormalizer::normalizeRelationshipType).collect(Collectors.toSet());
    }
}

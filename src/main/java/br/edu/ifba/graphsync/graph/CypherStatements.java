package br.edu.ifba.graphsync.graph;

import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Map;

/**
 * Builds the Cypher statements the graph sink runs.
 *
 * <p>Labels and relationship types cannot be parameters in Cypher, so they are inlined as
 * backtick-quoted identifiers; everything else is a parameter.</p>
 */
public final class CypherStatements {

    private CypherStatements() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static GraphStatement mergeNode(@NotNull NodeWrite node) {
        String cypher = "MERGE (n:" + quote(node.label()) + " {id: $id}) SET n = $props";
        return new GraphStatement(cypher, Map.of("id", node.id(), "props", node.properties()));
    }

    /**
     * Matches both endpoints by label and id and merges the relationship on its id.
     * Returns one row with {@code written} = 0 when an endpoint is missing.
     */
    @NotNull
    public static GraphStatement mergeRelationship(@NotNull RelationshipWrite relationship) {
        String cypher = "MATCH (s:" + quote(relationship.sourceLabel()) + " {id: $source_id}) "
            + "MATCH (t:" + quote(relationship.targetLabel()) + " {id: $target_id}) "
            + "MERGE (s)-[r:" + quote(relationship.type()) + " {id: $id}]->(t) "
            + "SET r = $props "
            + "RETURN count(r) AS written";
        return new GraphStatement(cypher, Map.of(
            "source_id", relationship.sourceId(),
            "target_id", relationship.targetId(),
            "id", relationship.id(),
            "props", relationship.properties()));
    }

    @NotNull
    public static GraphStatement createIdIndex(@NotNull String label) {
        String cypher = "CREATE INDEX " + quote(indexName(label)) + " IF NOT EXISTS "
            + "FOR (n:" + quote(label) + ") ON (n." + GraphSink.ID_PROPERTY + ")";
        return new GraphStatement(cypher, Map.of());
    }

    /**
     * Deletes up to {@code limit} scope-tagged relationships, returning {@code deleted}.
     */
    @NotNull
    public static GraphStatement deleteRelationshipBatch(@NotNull SyncScope scope, int limit) {
        String cypher = "MATCH ()-[r]->() WHERE " + scopePredicate("r", scope)
            + " WITH r LIMIT $limit DELETE r RETURN count(*) AS deleted";
        return new GraphStatement(cypher, scopeParameters(scope, limit));
    }

    /**
     * Detach-deletes up to {@code limit} scope-tagged nodes, returning {@code deleted}.
     */
    @NotNull
    public static GraphStatement deleteNodeBatch(@NotNull SyncScope scope, int limit) {
        String cypher = "MATCH (n) WHERE " + scopePredicate("n", scope)
            + " WITH n LIMIT $limit DETACH DELETE n RETURN count(*) AS deleted";
        return new GraphStatement(cypher, scopeParameters(scope, limit));
    }

    @NotNull
    public static GraphStatement countNodes(@NotNull SyncScope scope) {
        return new GraphStatement(
            "MATCH (n) WHERE " + scopePredicate("n", scope) + " RETURN count(n) AS total",
            scopeParameters(scope, 0));
    }

    @NotNull
    public static GraphStatement countRelationships(@NotNull SyncScope scope) {
        return new GraphStatement(
            "MATCH ()-[r]->() WHERE " + scopePredicate("r", scope) + " RETURN count(r) AS total",
            scopeParameters(scope, 0));
    }

    @NotNull
    public static GraphStatement findNode(@NotNull String label, @NotNull String id) {
        return new GraphStatement(
            "MATCH (n:" + quote(label) + " {id: $id}) RETURN labels(n) AS labels, properties(n) AS props LIMIT 1",
            Map.of("id", id));
    }

    @NotNull
    public static GraphStatement findRelationship(@NotNull String type, @NotNull String id) {
        return new GraphStatement(
            "MATCH (s)-[r:" + quote(type) + " {id: $id}]->(t) "
                + "RETURN type(r) AS type, s.id AS source_id, t.id AS target_id, properties(r) AS props LIMIT 1",
            Map.of("id", id));
    }

    /**
     * Quotes an identifier with backticks, doubling embedded backticks.
     */
    @NotNull
    static String quote(@NotNull String identifier) {
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be blank");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }

    static String indexName(String label) {
        return "graphsync_" + label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_") + "_id";
    }

    private static String scopePredicate(String variable, SyncScope scope) {
        String property = variable + "." + GraphSink.SCOPE_PROPERTY;
        return scope.isAll() ? property + " IS NOT NULL" : property + " = $scope";
    }

    private static Map<String, Object> scopeParameters(SyncScope scope, int limit) {
        if (scope.isAll()) {
            return limit > 0 ? Map.of("limit", limit) : Map.of();
        }
        return limit > 0 ? Map.of("scope", scope.key(), "limit", limit) : Map.of("scope", scope.key());
    }
}

package br.edu.ifba.graphsync.graph.impl;

import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.graph.GraphBatchTimeoutException;
import br.edu.ifba.graphsync.graph.GraphNode;
import br.edu.ifba.graphsync.graph.GraphRelationship;
import br.edu.ifba.graphsync.graph.GraphSink;
import br.edu.ifba.graphsync.graph.GraphStoreUnavailableException;
import br.edu.ifba.graphsync.graph.GraphTransaction;
import br.edu.ifba.graphsync.graph.NodeWrite;
import br.edu.ifba.graphsync.graph.RelationshipWrite;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory graph sink for tests and local runs.
 *
 * <p>Mirrors the Neo4j semantics the export relies on: nodes are keyed by label and id,
 * relationships by type and id, writes become visible on commit only, and a transaction
 * that outlives its timeout fails with {@link GraphBatchTimeoutException}. Thread-safe;
 * commits are serialized.</p>
 */
public class InMemoryGraphSink implements GraphSink {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphSink.class);

    // label -> (id -> properties)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Map<String, Object>>> nodes =
        new ConcurrentHashMap<>();

    // type -> (id -> relationship)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, StoredRelationship>> relationships =
        new ConcurrentHashMap<>();

    private final Set<String> indexedLabels = ConcurrentHashMap.newKeySet();

    private final Object commitLock = new Object();

    private volatile boolean available = true;

    @Override
    public void createIdIndex(@NotNull String label) {
        ensureAvailable("createIdIndex");
        if (indexedLabels.add(label)) {
            logger.debug("Created id index for label {}", label);
        }
    }

    @Override
    public long clearScope(@NotNull SyncScope scope, int batchSize) {
        ensureAvailable("clearScope");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        synchronized (commitLock) {
            long removedRelationships = 0;
            for (ConcurrentHashMap<String, StoredRelationship> byId : relationships.values()) {
                int before = byId.size();
                byId.values().removeIf(rel -> inScope(rel.properties(), scope));
                removedRelationships += before - byId.size();
            }
            long removedNodes = 0;
            for (Map.Entry<String, ConcurrentHashMap<String, Map<String, Object>>> entry : nodes.entrySet()) {
                String label = entry.getKey();
                List<String> doomed = new ArrayList<>();
                entry.getValue().forEach((id, props) -> {
                    if (inScope(props, scope)) {
                        doomed.add(id);
                    }
                });
                for (String id : doomed) {
                    entry.getValue().remove(id);
                    detach(label, id);
                    removedNodes++;
                }
            }
            logger.info("Cleared scope {}: {} node(s), {} relationship(s) deleted", scope, removedNodes, removedRelationships);
            return removedNodes;
        }
    }

    @Override
    @NotNull
    public GraphTransaction beginTransaction(@NotNull Duration timeout) {
        ensureAvailable("beginTransaction");
        return new InMemoryTransaction(System.nanoTime() + timeout.toNanos());
    }

    @Override
    public long countNodes(@NotNull SyncScope scope) {
        ensureAvailable("countNodes");
        return nodes.values().stream()
            .flatMap(byId -> byId.values().stream())
            .filter(props -> inScope(props, scope))
            .count();
    }

    @Override
    public long countRelationships(@NotNull SyncScope scope) {
        ensureAvailable("countRelationships");
        return relationships.values().stream()
            .flatMap(byId -> byId.values().stream())
            .filter(rel -> inScope(rel.properties(), scope))
            .count();
    }

    @Override
    @NotNull
    public Optional<GraphNode> findNode(@NotNull String label, @NotNull String id) {
        ensureAvailable("findNode");
        Map<String, Object> props = nodes.getOrDefault(label, new ConcurrentHashMap<>()).get(id);
        return props == null ? Optional.empty() : Optional.of(new GraphNode(Set.of(label), props));
    }

    @Override
    @NotNull
    public Optional<GraphRelationship> findRelationship(@NotNull String type, @NotNull String id) {
        ensureAvailable("findRelationship");
        StoredRelationship rel = relationships.getOrDefault(type, new ConcurrentHashMap<>()).get(id);
        return rel == null
            ? Optional.empty()
            : Optional.of(new GraphRelationship(type, rel.sourceId(), rel.targetId(), rel.properties()));
    }

    @Override
    public void close() {
        logger.debug("InMemoryGraphSink closed");
    }

    // ===== Inspection helpers =====

    /** Labels that currently have at least one node. */
    @NotNull
    public Set<String> labels() {
        Set<String> labels = new TreeSet<>();
        nodes.forEach((label, byId) -> {
            if (!byId.isEmpty()) {
                labels.add(label);
            }
        });
        return labels;
    }

    /** Relationship types that currently have at least one relationship. */
    @NotNull
    public Set<String> relationshipTypes() {
        Set<String> types = new TreeSet<>();
        relationships.forEach((type, byId) -> {
            if (!byId.isEmpty()) {
                types.add(type);
            }
        });
        return types;
    }

    @NotNull
    public Set<String> indexedLabels() {
        return Set.copyOf(indexedLabels);
    }

    /**
     * Simulates the store going away (false) or coming back (true).
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Overwrites one property of a stored node; used to simulate drift.
     */
    public void putNodeProperty(@NotNull String label, @NotNull String id, @NotNull String key, @NotNull Object value) {
        synchronized (commitLock) {
            Map<String, Object> current = nodes.getOrDefault(label, new ConcurrentHashMap<>()).get(id);
            if (current == null) {
                throw new IllegalArgumentException("No node " + label + "/" + id);
            }
            Map<String, Object> updated = new HashMap<>(current);
            updated.put(key, value);
            nodes.get(label).put(id, Map.copyOf(updated));
        }
    }

    /**
     * Removes a node and its relationships; used to simulate drift.
     */
    public void deleteNode(@NotNull String label, @NotNull String id) {
        synchronized (commitLock) {
            ConcurrentHashMap<String, Map<String, Object>> byId = nodes.get(label);
            if (byId != null && byId.remove(id) != null) {
                detach(label, id);
            }
        }
    }

    // ===== Internals =====

    private void detach(String label, String id) {
        for (ConcurrentHashMap<String, StoredRelationship> byId : relationships.values()) {
            byId.values().removeIf(rel -> rel.touches(label, id));
        }
    }

    private boolean nodeExists(String label, String id) {
        ConcurrentHashMap<String, Map<String, Object>> byId = nodes.get(label);
        return byId != null && byId.containsKey(id);
    }

    private static boolean inScope(Map<String, Object> props, SyncScope scope) {
        Object tag = props.get(SCOPE_PROPERTY);
        return scope.covers(tag == null ? null : tag.toString());
    }

    private void ensureAvailable(String operation) {
        if (!available) {
            throw new GraphStoreUnavailableException("in-memory graph store is offline", operation, null);
        }
    }

    private record StoredRelationship(
        String sourceLabel,
        String sourceId,
        String targetLabel,
        String targetId,
        Map<String, Object> properties
    ) {
        boolean touches(String label, String id) {
            return (sourceLabel.equals(label) && sourceId.equals(id))
                || (targetLabel.equals(label) && targetId.equals(id));
        }
    }

    /**
     * Buffers writes and applies them atomically on commit.
     */
    private final class InMemoryTransaction implements GraphTransaction {

        private final long deadlineNanos;
        private final Map<String, NodeWrite> pendingNodes = new HashMap<>();
        private final Map<String, RelationshipWrite> pendingRelationships = new HashMap<>();
        private boolean open = true;

        InMemoryTransaction(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public void mergeNode(@NotNull NodeWrite node) {
            check("mergeNode");
            pendingNodes.put(node.label() + "\u0000" + node.id(), node);
        }

        @Override
        public boolean mergeRelationship(@NotNull RelationshipWrite relationship) {
            check("mergeRelationship");
            boolean sourceFound = nodeExists(relationship.sourceLabel(), relationship.sourceId())
                || pendingNodes.containsKey(relationship.sourceLabel() + "\u0000" + relationship.sourceId());
            boolean targetFound = nodeExists(relationship.targetLabel(), relationship.targetId())
                || pendingNodes.containsKey(relationship.targetLabel() + "\u0000" + relationship.targetId());
            if (!sourceFound || !targetFound) {
                return false;
            }
            pendingRelationships.put(relationship.type() + "\u0000" + relationship.id(), relationship);
            return true;
        }

        @Override
        public void commit() {
            check("commit");
            synchronized (commitLock) {
                for (NodeWrite node : pendingNodes.values()) {
                    nodes.computeIfAbsent(node.label(), k -> new ConcurrentHashMap<>())
                        .put(node.id(), Map.copyOf(node.properties()));
                }
                for (RelationshipWrite rel : pendingRelationships.values()) {
                    relationships.computeIfAbsent(rel.type(), k -> new ConcurrentHashMap<>())
                        .put(rel.id(), new StoredRelationship(rel.sourceLabel(), rel.sourceId(),
                            rel.targetLabel(), rel.targetId(), Map.copyOf(rel.properties())));
                }
            }
            open = false;
        }

        @Override
        public void rollback() {
            pendingNodes.clear();
            pendingRelationships.clear();
            open = false;
        }

        @Override
        public void close() {
            if (open) {
                rollback();
            }
        }

        private void check(String operation) {
            ensureAvailable(operation);
            if (!open) {
                throw new IllegalStateException("Transaction is closed");
            }
            if (System.nanoTime() - deadlineNanos > 0) {
                rollback();
                throw new GraphBatchTimeoutException("transaction exceeded its timeout", operation, null);
            }
        }
    }
}

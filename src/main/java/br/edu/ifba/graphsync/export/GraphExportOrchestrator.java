package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.codec.SemiStructuredEncodingException;
import br.edu.ifba.graphsync.core.EntityRecord;
import br.edu.ifba.graphsync.core.RecordKind;
import br.edu.ifba.graphsync.core.ResolvedRelationship;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.graph.GraphBatchTimeoutException;
import br.edu.ifba.graphsync.graph.GraphPropertyMapper;
import br.edu.ifba.graphsync.graph.GraphSink;
import br.edu.ifba.graphsync.graph.GraphSinkException;
import br.edu.ifba.graphsync.graph.GraphStoreUnavailableException;
import br.edu.ifba.graphsync.graph.GraphTransaction;
import br.edu.ifba.graphsync.graph.NodeWrite;
import br.edu.ifba.graphsync.graph.RelationshipWrite;
import br.edu.ifba.graphsync.source.RecordSource;
import br.edu.ifba.graphsync.source.RecordSourceException;
import br.edu.ifba.graphsync.utils.LockUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports the entity and relationship records of a scope into the graph store.
 *
 * <h2>Run layout</h2>
 * <ol>
 *   <li>Take the scope lock; a concurrent run of the same scope fails with
 *       {@link ExportInProgressException}.</li>
 *   <li>Optionally clear the scope's graph elements.</li>
 *   <li>Create an {@code id} index for every canonical label of the scope.</li>
 *   <li>Export nodes label by label, one transaction per page; labels may run in parallel.</li>
 *   <li>Export relationships, one transaction per page, once every node page finished.</li>
 * </ol>
 *
 * <p>Writes are {@code MERGE}s keyed by record id, so a run can always be repeated.
 * A page that fails is rolled back and recorded; a timed-out page is skipped and the run
 * goes on, any other page failure stops the phase. Losing either store aborts the run with
 * {@link GraphExportException} carrying the partial {@link SyncRunRecord}.</p>
 */
public class GraphExportOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(GraphExportOrchestrator.class);

    static final String MDC_RUN = "sync.run";
    static final String MDC_SCOPE = "sync.scope";

    private static final String LOCK_PREFIX = "graphsync.export:";

    private final RecordSource source;
    private final GraphSink sink;
    private final GraphPropertyMapper mapper;
    private final ExportSettings settings;

    public GraphExportOrchestrator(
            @NotNull RecordSource source,
            @NotNull GraphSink sink,
            @NotNull GraphPropertyMapper mapper,
            @NotNull ExportSettings settings) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Runs one export.
     *
     * @param request scope, batch size, clear flag and cancellation signal
     * @return the run record, also when records or pages failed or the run was cancelled
     * @throws ExportInProgressException if the scope is being exported by another caller
     * @throws GraphExportException if a store became unreachable during the run
     */
    @NotNull
    public SyncRunRecord export(@NotNull ExportRequest request) {
        SyncScope scope = request.scope();
        String lockKey = LOCK_PREFIX + scope.key();
        acquireScopeLock(scope, lockKey);

        RunStats stats = new RunStats(UUID.randomUUID().toString(), scope, Instant.now());
        MDC.put(MDC_RUN, stats.runId());
        MDC.put(MDC_SCOPE, scope.key());
        try {
            logger.info("Export {} of scope {} started (batchSize={}, clearExisting={})",
                stats.runId(), scope, request.batchSize(), request.clearExisting());
            return run(request, stats);
        } finally {
            MDC.remove(MDC_RUN);
            MDC.remove(MDC_SCOPE);
            LockUtil.release(lockKey);
        }
    }

    private void acquireScopeLock(SyncScope scope, String lockKey) {
        try {
            if (!LockUtil.tryAcquire(lockKey, settings.lockTimeout())) {
                logger.warn("Export of scope {} rejected: another export holds the scope", scope);
                throw new ExportInProgressException(scope);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportInProgressException(scope, e);
        }
    }

    private SyncRunRecord run(ExportRequest request, RunStats stats) {
        SyncScope scope = request.scope();

        if (request.clearExisting()) {
            try {
                sink.clearScope(scope, request.batchSize());
            } catch (GraphSinkException e) {
                throw fatal(ExportPhase.CLEAR, stats, e);
            }
        }

        Map<String, List<String>> rawTypesByLabel;
        try {
            rawTypesByLabel = groupByLabel(source.distinctEntityTypes(scope));
            for (String label : rawTypesByLabel.keySet()) {
                sink.createIdIndex(label);
            }
        } catch (GraphSinkException | RecordSourceException e) {
            throw fatal(ExportPhase.INDEX, stats, e);
        }
        logger.debug("Scope {} maps to {} label(s): {}", scope, rawTypesByLabel.size(), rawTypesByLabel.keySet());

        boolean nodesComplete = exportNodes(request, rawTypesByLabel, stats);
        if (request.cancellationSignal().isCancelled()) {
            stats.markCancelled();
            return finish(stats);
        }
        if (!nodesComplete) {
            logger.warn("Node export of scope {} stopped after a failed page, skipping relationships", scope);
            stats.markRelationshipPhaseSkipped();
            return finish(stats);
        }

        try {
            exportRelationships(request, stats);
        } catch (GraphStoreUnavailableException | RecordSourceException e) {
            throw fatal(ExportPhase.RELATIONSHIPS, stats, e);
        }
        return finish(stats);
    }

    /**
     * Groups raw entity types by the label they normalize to; distinct raw types may share one.
     */
    private Map<String, List<String>> groupByLabel(List<String> rawTypes) {
        Map<String, List<String>> byLabel = new TreeMap<>();
        for (String rawType : rawTypes) {
            byLabel.computeIfAbsent(mapper.normalizer().label(rawType), k -> new ArrayList<>()).add(rawType);
        }
        return byLabel;
    }

    // ===== Node phase =====

    /**
     * @return false when a page failed (other than by timeout) and the phase stopped early
     */
    private boolean exportNodes(ExportRequest request, Map<String, List<String>> rawTypesByLabel, RunStats stats) {
        if (rawTypesByLabel.isEmpty()) {
            return true;
        }
        AtomicBoolean halted = new AtomicBoolean();
        AtomicReference<RuntimeException> fatal = new AtomicReference<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        int threads = Math.min(settings.nodeExportParallelism(), rawTypesByLabel.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new NodeWorkerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Map.Entry<String, List<String>> entry : rawTypesByLabel.entrySet()) {
                futures.add(pool.submit(() -> withMdc(mdc,
                    () -> exportLabel(request, entry.getKey(), entry.getValue(), stats, halted, fatal))));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    fatal.compareAndSet(null, cause instanceof RuntimeException runtime
                        ? runtime : new IllegalStateException(cause));
                    halted.set(true);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            halted.set(true);
            stats.markCancelled();
            logger.warn("Interrupted while waiting for node export of scope {}", request.scope());
        } finally {
            pool.shutdown();
            awaitPool(pool);
        }

        RuntimeException failure = fatal.get();
        if (failure != null) {
            throw fatal(ExportPhase.NODES, stats, failure);
        }
        return !halted.get();
    }

    private void exportLabel(ExportRequest request, String label, List<String> rawTypes, RunStats stats,
                             AtomicBoolean halted, AtomicReference<RuntimeException> fatal) {
        String afterId = null;
        int pageIndex = 0;
        while (!halted.get()) {
            if (request.cancellationSignal().isCancelled()) {
                stats.markCancelled();
                return;
            }
            List<EntityRecord> page;
            try {
                page = source.readEntities(request.scope(), rawTypes, afterId, request.batchSize());
            } catch (RecordSourceException e) {
                if (e.isConnectivityFailure()) {
                    fatal.compareAndSet(null, e);
                } else {
                    stats.batchFailure(new BatchFailure(ExportPhase.NODES, label, pageIndex, 0, e.getMessage(), false));
                    logger.error("Reading node page {} of label {} failed: {}", pageIndex, label, e.getMessage());
                }
                halted.set(true);
                return;
            }
            if (page.isEmpty()) {
                return;
            }
            stats.nodesAttempted.addAndGet(page.size());
            afterId = page.get(page.size() - 1).id();

            PageOutcome outcome;
            try {
                outcome = writeNodePage(label, pageIndex, page, stats);
            } catch (GraphStoreUnavailableException e) {
                fatal.compareAndSet(null, e);
                halted.set(true);
                return;
            }
            if (outcome == PageOutcome.FAILED) {
                halted.set(true);
                return;
            }
            if (page.size() < request.batchSize()) {
                return;
            }
            pageIndex++;
        }
    }

    private PageOutcome writeNodePage(String label, int pageIndex, List<EntityRecord> page,
                                      RunStats stats) {
        List<NodeWrite> writes = new ArrayList<>(page.size());
        for (EntityRecord entity : page) {
            try {
                writes.add(mapper.toNodeWrite(entity));
            } catch (SemiStructuredEncodingException e) {
                logger.warn("Entity {} skipped: {}", entity.id(), e.getMessage());
                stats.recordFailure(RecordKind.NODE, entity.id(), e.getMessage());
            }
        }
        if (writes.isEmpty()) {
            return PageOutcome.COMMITTED;
        }

        Duration timeout = settings.batchTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        try (GraphTransaction tx = sink.beginTransaction(timeout)) {
            try {
                for (NodeWrite write : writes) {
                    tx.mergeNode(write);
                }
                checkDeadline(deadline, timeout);
                tx.commit();
            } catch (GraphSinkException e) {
                rollbackQuietly(tx);
                throw e;
            }
        } catch (GraphBatchTimeoutException e) {
            stats.nodesFailed.addAndGet(writes.size());
            stats.batchFailure(new BatchFailure(ExportPhase.NODES, label, pageIndex, writes.size(), e.getMessage(), true));
            logger.warn("Node page {} of label {} timed out and was rolled back ({} nodes)", pageIndex, label, writes.size());
            return PageOutcome.TIMED_OUT;
        } catch (GraphStoreUnavailableException e) {
            stats.nodesFailed.addAndGet(writes.size());
            throw e;
        } catch (GraphSinkException e) {
            stats.nodesFailed.addAndGet(writes.size());
            stats.batchFailure(new BatchFailure(ExportPhase.NODES, label, pageIndex, writes.size(), e.getMessage(), false));
            logger.error("Node page {} of label {} failed and was rolled back: {}", pageIndex, label, e.getMessage());
            return PageOutcome.FAILED;
        }

        stats.nodesSucceeded.addAndGet(writes.size());
        stats.labelWritten(label);
        logger.debug("Committed node page {} of label {} ({} nodes)", pageIndex, label, writes.size());
        return PageOutcome.COMMITTED;
    }

    // ===== Relationship phase =====

    private void exportRelationships(ExportRequest request, RunStats stats) {
        String afterId = null;
        int pageIndex = 0;
        while (true) {
            if (request.cancellationSignal().isCancelled()) {
                stats.markCancelled();
                return;
            }
            List<ResolvedRelationship> page;
            try {
                page = source.readRelationships(request.scope(), afterId, request.batchSize());
            } catch (RecordSourceException e) {
                if (e.isConnectivityFailure()) {
                    throw e;
                }
                stats.batchFailure(new BatchFailure(ExportPhase.RELATIONSHIPS, null, pageIndex, 0, e.getMessage(), false));
                logger.error("Reading relationship page {} failed: {}", pageIndex, e.getMessage());
                return;
            }
            if (page.isEmpty()) {
                return;
            }
            stats.relationshipsAttempted.addAndGet(page.size());
            afterId = page.get(page.size() - 1).record().id();

            if (writeRelationshipPage(pageIndex, page, stats) == PageOutcome.FAILED) {
                return;
            }
            if (page.size() < request.batchSize()) {
                return;
            }
            pageIndex++;
        }
    }

    private PageOutcome writeRelationshipPage(int pageIndex, List<ResolvedRelationship> page, RunStats stats) {
        List<RelationshipWrite> writes = new ArrayList<>(page.size());
        for (ResolvedRelationship resolved : page) {
            String id = resolved.record().id();
            if (resolved.sourceEntityType() == null) {
                danglingRelationship(stats, id, "source entity '" + resolved.record().sourceEntityId() + "' does not exist");
            } else if (resolved.targetEntityType() == null) {
                danglingRelationship(stats, id, "target entity '" + resolved.record().targetEntityId() + "' does not exist");
            } else {
                try {
                    writes.add(mapper.toRelationshipWrite(resolved));
                } catch (SemiStructuredEncodingException e) {
                    logger.warn("Relationship {} skipped: {}", id, e.getMessage());
                    stats.recordFailure(RecordKind.RELATIONSHIP, id, e.getMessage());
                }
            }
        }
        if (writes.isEmpty()) {
            return PageOutcome.COMMITTED;
        }

        List<RelationshipWrite> unmatched = new ArrayList<>();
        Set<String> types = new TreeSet<>();
        Duration timeout = settings.batchTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        try (GraphTransaction tx = sink.beginTransaction(timeout)) {
            try {
                for (RelationshipWrite write : writes) {
                    if (tx.mergeRelationship(write)) {
                        types.add(write.type());
                    } else {
                        unmatched.add(write);
                    }
                }
                checkDeadline(deadline, timeout);
                tx.commit();
            } catch (GraphSinkException e) {
                rollbackQuietly(tx);
                throw e;
            }
        } catch (GraphBatchTimeoutException e) {
            stats.relationshipsFailed.addAndGet(writes.size());
            stats.batchFailure(new BatchFailure(ExportPhase.RELATIONSHIPS, null, pageIndex, writes.size(), e.getMessage(), true));
            logger.warn("Relationship page {} timed out and was rolled back ({} relationships)", pageIndex, writes.size());
            return PageOutcome.TIMED_OUT;
        } catch (GraphStoreUnavailableException e) {
            stats.relationshipsFailed.addAndGet(writes.size());
            throw e;
        } catch (GraphSinkException e) {
            stats.relationshipsFailed.addAndGet(writes.size());
            stats.batchFailure(new BatchFailure(ExportPhase.RELATIONSHIPS, null, pageIndex, writes.size(), e.getMessage(), false));
            logger.error("Relationship page {} failed and was rolled back: {}", pageIndex, e.getMessage());
            return PageOutcome.FAILED;
        }

        for (RelationshipWrite write : unmatched) {
            danglingRelationship(stats, write.id(), missingEndpoint(write));
        }
        stats.relationshipsSucceeded.addAndGet(writes.size() - unmatched.size());
        stats.relationshipTypesWritten(types);
        logger.debug("Committed relationship page {} ({} written, {} unmatched)",
            pageIndex, writes.size() - unmatched.size(), unmatched.size());
        return PageOutcome.COMMITTED;
    }

    /**
     * Names the endpoint node a relationship could not be matched to. Both can be missing;
     * the source is reported first.
     */
    private String missingEndpoint(RelationshipWrite write) {
        String source = write.sourceLabel() + "/" + write.sourceId();
        String target = write.targetLabel() + "/" + write.targetId();
        try {
            if (sink.findNode(write.sourceLabel(), write.sourceId()).isEmpty()) {
                return "source node " + source + " not found in graph";
            }
            if (sink.findNode(write.targetLabel(), write.targetId()).isEmpty()) {
                return "target node " + target + " not found in graph";
            }
        } catch (GraphSinkException e) {
            logger.debug("Could not look up the endpoints of relationship {}: {}", write.id(), e.getMessage());
        }
        return "one of the endpoint nodes " + source + " or " + target + " not found in graph";
    }

    private static void danglingRelationship(RunStats stats, String id, String reason) {
        logger.warn("Relationship {} skipped: {}", id, reason);
        stats.recordFailure(RecordKind.RELATIONSHIP, id, "dangling reference: " + reason);
    }

    // ===== Helpers =====

    private static void checkDeadline(long deadline, Duration timeout) {
        if (System.nanoTime() - deadline > 0) {
            throw new GraphBatchTimeoutException("page did not finish within " + timeout, "commit", null);
        }
    }

    private static void rollbackQuietly(GraphTransaction tx) {
        try {
            tx.rollback();
        } catch (RuntimeException e) {
            logger.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private SyncRunRecord finish(RunStats stats) {
        SyncRunRecord record = stats.snapshot();
        logger.info("Export {} of scope {} finished in {} ms: nodes {}/{} ok ({} failed), "
                + "relationships {}/{} ok ({} failed), labels={}, types={}, cancelled={}",
            record.runId(), record.scope(), record.elapsed().toMillis(),
            record.nodesSucceeded(), record.nodesAttempted(), record.nodesFailed(),
            record.relationshipsSucceeded(), record.relationshipsAttempted(), record.relationshipsFailed(),
            record.labels(), record.relationshipTypes(), record.cancelled());
        return record;
    }

    private GraphExportException fatal(ExportPhase phase, RunStats stats, RuntimeException cause) {
        logger.error("Export {} aborted during {}: {}", stats.runId(), phase, cause.getMessage());
        return new GraphExportException(cause.getMessage(), phase, stats.snapshot(), cause);
    }

    private static void withMdc(Map<String, String> context, Runnable work) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            work.run();
        } finally {
            MDC.clear();
        }
    }

    private static void awaitPool(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Node export workers did not stop within one minute");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private enum PageOutcome {
        COMMITTED,
        TIMED_OUT,
        FAILED
    }

    private static final class NodeWorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable task) {
            Thread thread = new Thread(task, "graphsync-nodes-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

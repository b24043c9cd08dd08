package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.RecordKind;
import br.edu.ifba.graphsync.core.SyncScope;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters of a running export; node pages of different labels update it
 * concurrently.
 */
final class RunStats {

    private final String runId;
    private final SyncScope scope;
    private final Instant startedAt;

    final AtomicLong nodesAttempted = new AtomicLong();
    final AtomicLong nodesSucceeded = new AtomicLong();
    final AtomicLong nodesFailed = new AtomicLong();
    final AtomicLong relationshipsAttempted = new AtomicLong();
    final AtomicLong relationshipsSucceeded = new AtomicLong();
    final AtomicLong relationshipsFailed = new AtomicLong();

    private final Set<String> labels = new ConcurrentSkipListSet<>();
    private final Set<String> relationshipTypes = new ConcurrentSkipListSet<>();
    private final ConcurrentLinkedQueue<RecordFailure> recordFailures = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<BatchFailure> batchFailures = new ConcurrentLinkedQueue<>();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean relationshipPhaseSkipped = new AtomicBoolean();

    RunStats(String runId, SyncScope scope, Instant startedAt) {
        this.runId = runId;
        this.scope = scope;
        this.startedAt = startedAt;
    }

    void recordFailure(RecordKind kind, String recordId, String reason) {
        recordFailures.add(new RecordFailure(kind, recordId, reason));
        (kind == RecordKind.NODE ? nodesFailed : relationshipsFailed).incrementAndGet();
    }

    void batchFailure(BatchFailure failure) {
        batchFailures.add(failure);
    }

    void labelWritten(String label) {
        labels.add(label);
    }

    void relationshipTypesWritten(Iterable<String> types) {
        for (String type : types) {
            relationshipTypes.add(type);
        }
    }

    void markCancelled() {
        cancelled.set(true);
    }

    void markRelationshipPhaseSkipped() {
        relationshipPhaseSkipped.set(true);
    }

    String runId() {
        return runId;
    }

    SyncRunRecord snapshot() {
        Instant finishedAt = Instant.now();
        return new SyncRunRecord(
            runId,
            scope,
            startedAt,
            finishedAt,
            Duration.between(startedAt, finishedAt),
            nodesAttempted.get(),
            nodesSucceeded.get(),
            nodesFailed.get(),
            relationshipsAttempted.get(),
            relationshipsSucceeded.get(),
            relationshipsFailed.get(),
            labels,
            relationshipTypes,
            cancelled.get(),
            relationshipPhaseSkipped.get(),
            new ArrayList<>(recordFailures),
            List.copyOf(batchFailures));
    }
}

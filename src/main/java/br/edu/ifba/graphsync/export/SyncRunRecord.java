package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one export run.
 *
 * <p>Counts are per record: {@code attempted = succeeded + failed} for nodes and for
 * relationships, except for records that were never read because the run stopped early.</p>
 *
 * @param runId unique id of the run
 * @param scope exported scope
 * @param startedAt start time
 * @param finishedAt end time
 * @param elapsed wall-clock duration
 * @param nodesAttempted entity records read
 * @param nodesSucceeded nodes committed
 * @param nodesFailed nodes not written
 * @param relationshipsAttempted relationship records read
 * @param relationshipsSucceeded relationships committed
 * @param relationshipsFailed relationships not written
 * @param labels distinct canonical labels written
 * @param relationshipTypes distinct canonical relationship types written
 * @param cancelled whether the run stopped because of a cancellation request
 * @param relationshipPhaseSkipped whether relationship export was skipped after a node page failure
 * @param recordFailures per-record failures
 * @param batchFailures rolled back pages
 */
public record SyncRunRecord(
    @NotNull String runId,
    @NotNull SyncScope scope,
    @NotNull Instant startedAt,
    @NotNull Instant finishedAt,
    @NotNull Duration elapsed,
    long nodesAttempted,
    long nodesSucceeded,
    long nodesFailed,
    long relationshipsAttempted,
    long relationshipsSucceeded,
    long relationshipsFailed,
    @NotNull Set<String> labels,
    @NotNull Set<String> relationshipTypes,
    boolean cancelled,
    boolean relationshipPhaseSkipped,
    @NotNull List<RecordFailure> recordFailures,
    @NotNull List<BatchFailure> batchFailures
) {

    public SyncRunRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        labels = Set.copyOf(labels);
        relationshipTypes = Set.copyOf(relationshipTypes);
        recordFailures = List.copyOf(recordFailures);
        batchFailures = List.copyOf(batchFailures);
    }

    /**
     * True when every attempted record was written and the run was not cancelled.
     */
    public boolean isComplete() {
        return !cancelled && !relationshipPhaseSkipped && nodesFailed == 0 && relationshipsFailed == 0
            && batchFailures.isEmpty();
    }
}

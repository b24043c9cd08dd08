package br.edu.ifba.graphsync.export;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the export orchestrator that do not change per run.
 *
 * @param batchTimeout maximum duration of one page transaction
 * @param nodeExportParallelism number of labels exported concurrently
 * @param lockTimeout how long to wait for the scope lock
 */
public record ExportSettings(
    @NotNull Duration batchTimeout,
    int nodeExportParallelism,
    @NotNull Duration lockTimeout
) {

    public ExportSettings {
        Objects.requireNonNull(batchTimeout, "batchTimeout must not be null");
        Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
        if (batchTimeout.isNegative() || batchTimeout.isZero()) {
            throw new IllegalArgumentException("batchTimeout must be positive");
        }
        if (nodeExportParallelism < 1) {
            throw new IllegalArgumentException("nodeExportParallelism must be at least 1");
        }
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must not be negative");
        }
    }

    @NotNull
    public static ExportSettings defaults() {
        return new ExportSettings(Duration.ofSeconds(30), 1, Duration.ofSeconds(5));
    }
}

package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Parameters of one export run.
 *
 * @param scope the scope to export
 * @param batchSize records per page and per graph transaction
 * @param clearExisting whether to delete the scope's graph elements first
 * @param cancellationSignal polled between batches; null means never cancelled
 */
public record ExportRequest(
    @NotNull SyncScope scope,
    int batchSize,
    boolean clearExisting,
    @Nullable CancellationSignal cancellationSignal
) {

    public static final int DEFAULT_BATCH_SIZE = 1000;

    public ExportRequest {
        Objects.requireNonNull(scope, "scope must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (cancellationSignal == null) {
            cancellationSignal = CancellationSignal.NONE;
        }
    }

    @NotNull
    public static ExportRequest of(@NotNull SyncScope scope) {
        return new ExportRequest(scope, DEFAULT_BATCH_SIZE, false, null);
    }
}

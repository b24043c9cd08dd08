package br.edu.ifba.graphsync.export;

/**
 * Thrown when an export run aborts because one of the stores became unreachable.
 *
 * <p>The batch in flight was rolled back. {@link #getPartialRun()} reports what had been
 * committed before the failure; re-running the export for the same scope is safe.</p>
 */
public final class GraphExportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ExportPhase phase;
    private final transient SyncRunRecord partialRun;

    public GraphExportException(String message, ExportPhase phase, SyncRunRecord partialRun, Throwable cause) {
        super(String.format("Export of scope '%s' aborted during %s: %s",
            partialRun.scope().key(), phase, message), cause);
        this.phase = phase;
        this.partialRun = partialRun;
    }

    public ExportPhase getPhase() {
        return phase;
    }

    public SyncRunRecord getPartialRun() {
        return partialRun;
    }
}

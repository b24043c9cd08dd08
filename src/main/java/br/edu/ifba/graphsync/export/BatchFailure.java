package br.edu.ifba.graphsync.export;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A page whose transaction was rolled back.
 *
 * @param phase phase the page belongs to
 * @param label canonical label for node pages, null for relationship pages
 * @param pageIndex zero-based page index within the label (nodes) or the relationship scan
 * @param recordCount records the page held
 * @param reason human readable cause
 * @param timedOut true when the page exceeded the batch timeout; the run continued past it
 */
public record BatchFailure(
    @NotNull ExportPhase phase,
    @Nullable String label,
    int pageIndex,
    int recordCount,
    @NotNull String reason,
    boolean timedOut
) {

    public BatchFailure {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if (pageIndex < 0) {
            throw new IllegalArgumentException("pageIndex must not be negative");
        }
    }
}

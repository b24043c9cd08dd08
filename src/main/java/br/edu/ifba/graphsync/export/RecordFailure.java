package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.RecordKind;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single record that could not be exported; the rest of its batch was unaffected.
 *
 * @param kind node or relationship
 * @param recordId id of the failed record
 * @param reason human readable cause
 */
public record RecordFailure(@NotNull RecordKind kind, @NotNull String recordId, @NotNull String reason) {

    public RecordFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}

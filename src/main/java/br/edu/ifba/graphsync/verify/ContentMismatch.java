package br.edu.ifba.graphsync.verify;

import br.edu.ifba.graphsync.core.RecordKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One difference found by the content check.
 *
 * @param kind node or relationship
 * @param recordId id of the sampled record
 * @param problem what differs
 * @param key property name for {@link MismatchProblem#PROPERTY}, null otherwise
 * @param expected value derived from the relational record (canonical form)
 * @param actual value found in the graph (canonical form)
 */
public record ContentMismatch(
    @NotNull RecordKind kind,
    @NotNull String recordId,
    @NotNull MismatchProblem problem,
    @Nullable String key,
    @Nullable Object expected,
    @Nullable Object actual
) {

    public ContentMismatch {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(problem, "problem must not be null");
    }

    static ContentMismatch of(RecordKind kind, String recordId, MismatchProblem problem,
                              @Nullable Object expected, @Nullable Object actual) {
        return new ContentMismatch(kind, recordId, problem, null, expected, actual);
    }
}

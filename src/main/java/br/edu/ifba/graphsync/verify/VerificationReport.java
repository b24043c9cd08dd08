package br.edu.ifba.graphsync.verify;

import br.edu.ifba.graphsync.core.SyncScope;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Result of verifying a scope.
 *
 * @param scope verified scope
 * @param countCheck element counts
 * @param mismatches content differences found in the sample
 * @param sampledEntities entity records compared
 * @param sampledRelationships relationship records compared
 */
public record VerificationReport(
    @NotNull SyncScope scope,
    @NotNull CountCheck countCheck,
    @NotNull List<ContentMismatch> mismatches,
    int sampledEntities,
    int sampledRelationships
) {

    public VerificationReport {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(countCheck, "countCheck must not be null");
        mismatches = List.copyOf(mismatches);
    }

    /**
     * True when counts match and the sample showed no difference.
     */
    public boolean inSync() {
        return countCheck.inSync() && mismatches.isEmpty();
    }
}

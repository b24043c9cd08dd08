package br.edu.ifba.graphsync;

import br.edu.ifba.graphsync.config.GraphSyncConfig;
import br.edu.ifba.graphsync.core.SyncScope;
import br.edu.ifba.graphsync.export.CancellationSignal;
import br.edu.ifba.graphsync.export.ExportRequest;
import br.edu.ifba.graphsync.export.GraphExportOrchestrator;
import br.edu.ifba.graphsync.export.SyncRunRecord;
import br.edu.ifba.graphsync.utils.TransientSQLExceptionPredicate;
import br.edu.ifba.graphsync.verify.SyncVerifier;
import br.edu.ifba.graphsync.verify.VerificationReport;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.temporal.ChronoUnit;

/**
 * Entry point of the relational-to-graph synchronization.
 *
 * <p>{@code export} is the only mutating operation and is never retried here; callers
 * decide whether to run it again (it is idempotent). {@code verify} is read-only and is
 * retried on transient relational failures.</p>
 */
@ApplicationScoped
public class GraphSyncService {

    @Inject
    GraphExportOrchestrator orchestrator;

    @Inject
    SyncVerifier verifier;

    @Inject
    GraphSyncConfig config;

    /**
     * Default constructor for CDI.
     */
    public GraphSyncService() {
    }

    GraphSyncService(GraphExportOrchestrator orchestrator, SyncVerifier verifier, GraphSyncConfig config) {
        this.orchestrator = orchestrator;
        this.verifier = verifier;
        this.config = config;
    }

    /**
     * Exports a scope with the configured batch size, keeping existing graph elements.
     */
    @NotNull
    public SyncRunRecord export(@NotNull SyncScope scope) {
        return export(scope, config.batchSize(), false, null);
    }

    /**
     * Exports a scope.
     *
     * @param scope the scope to export
     * @param batchSize records per page and transaction
     * @param clearExisting delete the scope's graph elements first
     * @param cancellationSignal polled between batches (may be null)
     * @return the run record
     */
    @NotNull
    public SyncRunRecord export(@NotNull SyncScope scope, int batchSize, boolean clearExisting,
                                @Nullable CancellationSignal cancellationSignal) {
        return orchestrator.export(new ExportRequest(scope, batchSize, clearExisting, cancellationSignal));
    }

    /**
     * Verifies a scope with the configured sample size.
     */
    @NotNull
    @Retry(maxRetries = 3, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSQLExceptionPredicate.class)
    public VerificationReport verify(@NotNull SyncScope scope) {
        return verifier.verify(scope, config.verify().sampleSize());
    }

    /**
     * Verifies a scope: element counts plus a content comparison of a random sample.
     *
     * @param scope the scope to verify
     * @param sampleSize entities and relationships to sample
     * @return the verification report; differences are data, never exceptions
     */
    @NotNull
    @Retry(maxRetries = 3, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSQLExceptionPredicate.class)
    public VerificationReport verify(@NotNull SyncScope scope, int sampleSize) {
        return verifier.verify(scope, sampleSize);
    }

    @NotNull
    public String normalizeLabel(@Nullable String raw) {
        return config.normalizer().label(raw);
    }

    @NotNull
    public String normalizeRelationshipType(@Nullable String raw) {
        return config.normalizer().relationshipType(raw);
    }
}

package br.edu.ifba.graphsync.export;

/**
 * Lets a caller stop an export run between batches.
 *
 * <p>The orchestrator polls {@link #isCancelled()} before starting each batch; a batch that
 * already started finishes normally.</p>
 */
@FunctionalInterface
public interface CancellationSignal {

    /** A signal that is never raised. */
    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}

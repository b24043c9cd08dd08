package br.edu.ifba.graphsync.export;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link CancellationSignal} that can be raised from any thread.
 */
public final class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}

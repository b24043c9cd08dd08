package br.edu.ifba.graphsync.export;

import br.edu.ifba.graphsync.core.SyncScope;

/**
 * Thrown when an export is requested for a scope another export currently holds.
 */
public final class ExportInProgressException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SyncScope scope;

    public ExportInProgressException(SyncScope scope) {
        super(String.format("An export of scope '%s' is already running", scope.key()));
        this.scope = scope;
    }

    public ExportInProgressException(SyncScope scope, Throwable cause) {
        super(String.format("Interrupted while waiting to export scope '%s'", scope.key()), cause);
        this.scope = scope;
    }

    public SyncScope getScope() {
        return scope;
    }
}

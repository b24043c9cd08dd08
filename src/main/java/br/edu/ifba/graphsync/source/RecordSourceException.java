package br.edu.ifba.graphsync.source;

/**
 * Thrown when the relational record store cannot serve a read or write.
 *
 * <p>{@link #isConnectivityFailure()} tells a lost or unreachable store apart from a
 * failing statement; an export run aborts on the former.</p>
 */
public final class RecordSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final boolean connectivityFailure;

    /**
     * Creates a new RecordSourceException.
     *
     * @param message the error description
     * @param operation the repository operation that failed, e.g. {@code readEntities}
     * @param connectivityFailure whether the store was unreachable
     * @param cause the underlying exception
     */
    public RecordSourceException(String message, String operation, boolean connectivityFailure, Throwable cause) {
        super(String.format("Record store %s failed: %s", operation, message), cause);
        this.operation = operation;
        this.connectivityFailure = connectivityFailure;
    }

    public String getOperation() {
        return operation;
    }

    public boolean isConnectivityFailure() {
        return connectivityFailure;
    }
}

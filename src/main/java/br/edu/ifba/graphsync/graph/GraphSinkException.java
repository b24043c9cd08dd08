package br.edu.ifba.graphsync.graph;

/**
 * Thrown when a graph store operation fails.
 */
public class GraphSinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    /**
     * Creates a new GraphSinkException.
     *
     * @param message the error description
     * @param operation the sink operation that failed, e.g. {@code mergeNode}
     * @param cause the underlying exception (may be null)
     */
    public GraphSinkException(String message, String operation, Throwable cause) {
        super(String.format("Graph %s failed: %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

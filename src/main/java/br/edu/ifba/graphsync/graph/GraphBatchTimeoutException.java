package br.edu.ifba.graphsync.graph;

/**
 * Thrown when a graph transaction exceeds its timeout and is aborted.
 */
public class GraphBatchTimeoutException extends GraphSinkException {

    private static final long serialVersionUID = 1L;

    public GraphBatchTimeoutException(String message, String operation, Throwable cause) {
        super(message, operation, cause);
    }
}

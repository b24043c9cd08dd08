package br.edu.ifba.graphsync.graph;

/**
 * Thrown when the graph store cannot be reached or the session to it was lost.
 */
public class GraphStoreUnavailableException extends GraphSinkException {

    private static final long serialVersionUID = 1L;

    public GraphStoreUnavailableException(String message, String operation, Throwable cause) {
        super(message, operation, cause);
    }
}

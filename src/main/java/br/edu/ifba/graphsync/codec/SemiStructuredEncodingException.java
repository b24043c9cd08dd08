package br.edu.ifba.graphsync.codec;

/**
 * Thrown when a value cannot be encoded for a semi-structured column.
 *
 * <p>Raised at encode time, before anything reaches the JDBC driver, so the caller can
 * fail the single record that carried the value.</p>
 */
public final class SemiStructuredEncodingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;

    /**
     * Creates a new SemiStructuredEncodingException.
     *
     * @param message the error description
     * @param path the location of the offending value, e.g. {@code $.attributes.file}
     */
    public SemiStructuredEncodingException(String message, String path) {
        super(buildMessage(message, path));
        this.path = path;
    }

    /**
     * Creates a new SemiStructuredEncodingException with a cause.
     *
     * @param message the error description
     * @param path the location of the offending value
     * @param cause the underlying exception
     */
    public SemiStructuredEncodingException(String message, String path, Throwable cause) {
        super(buildMessage(message, path), cause);
        this.path = path;
    }

    private static String buildMessage(String message, String path) {
        return String.format("Cannot encode semi-structured value at '%s': %s", path, message);
    }

    /**
     * Returns the location of the value that could not be encoded.
     *
     * @return the value path
     */
    public String getPath() {
        return path;
    }
}

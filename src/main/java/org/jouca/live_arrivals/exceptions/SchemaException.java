package org.jouca.live_arrivals.exceptions;

/**
 * Exception thrown when a live-data response does not have the expected envelope.
 *
 * <p>A schema mismatch is fatal for the fetch that produced it and is never retried:
 * the same payload would fail again. The raw payload is logged by the decoder before
 * this exception is raised.
 *
 * @author Jouca
 * @since 1.0
 */
public class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new schema exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public SchemaException(String message) {
        super(message);
    }

    /**
     * Constructs a new schema exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying cause of the error
     */
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}

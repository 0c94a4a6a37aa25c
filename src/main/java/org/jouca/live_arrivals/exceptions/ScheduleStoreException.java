package org.jouca.live_arrivals.exceptions;

/**
 * Exception thrown when the static schedule database cannot be queried.
 *
 * <p>Missing rows are not errors: lookups return null or an empty collection. This exception
 * only signals that the database itself failed.
 *
 * @author Jouca
 * @since 1.0
 */
public class ScheduleStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new schedule store exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying cause of the error
     */
    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.jouca.live_arrivals.exceptions;

import java.util.List;

/**
 * Exception thrown when a live-data source cannot be reached.
 *
 * <p>Covers connection errors, timeouts and non-2xx HTTP statuses. A transport failure only
 * concerns the stop codes of the fetch that failed; results already collected for other
 * groups or taken from the cache stay valid.
 *
 * @author Jouca
 * @since 1.0
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stop codes of the failed fetch, never null. */
    private final List<String> stopCodes;

    /**
     * Constructs a new transport exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public TransportException(String message) {
        this(message, List.of(), null);
    }

    /**
     * Constructs a new transport exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying cause of the error
     */
    public TransportException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    /**
     * Constructs a new transport exception for a specific group of stop codes.
     *
     * @param message the detail message explaining the error
     * @param stopCodes the stop codes whose fetch failed
     * @param cause the underlying cause of the error
     */
    public TransportException(String message, List<String> stopCodes, Throwable cause) {
        super(message, cause);
        this.stopCodes = stopCodes == null ? List.of() : List.copyOf(stopCodes);
    }

    /**
     * Returns the stop codes whose fetch failed.
     *
     * @return an immutable list, empty when the failure is not tied to specific stops
     */
    public List<String> getStopCodes() {
        return stopCodes;
    }
}

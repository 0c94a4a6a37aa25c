package org.jouca.live_arrivals.exceptions;

/**
 * Exception thrown when a single request asks for more stop codes than allowed.
 *
 * @author Jouca
 * @since 1.0
 */
public class TooManyStopsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The maximum number of stop codes accepted per request. */
    private final int maxStops;

    /**
     * Constructs a new exception for a request exceeding {@code maxStops}.
     *
     * @param maxStops the configured limit
     */
    public TooManyStopsException(int maxStops) {
        super("Maximum " + maxStops + " stops per request, please");
        this.maxStops = maxStops;
    }

    public int getMaxStops() {
        return maxStops;
    }
}

package org.jouca.live_arrivals.records;

/**
 * A row of the static schedule {@code stop_times} table.
 *
 * @author Jouca
 * @since 1.0
 */
public record StopTime(String tripId, String stopId, int stopSequence, String arrivalTime, String departureTime) {}

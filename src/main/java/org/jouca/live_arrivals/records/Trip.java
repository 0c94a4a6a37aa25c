package org.jouca.live_arrivals.records;

/**
 * A row of the static schedule {@code trips} table.
 *
 * @param tripId natural key, day scoped ({@code {number}_{ddMMyy}})
 * @param routeId the route this trip runs on
 * @param serviceId the service calendar id
 * @param tripHeadsign the headsign, may be empty
 * @param directionId 0 or 1, null when the schedule omits it
 *
 * @author Jouca
 * @since 1.0
 */
public record Trip(String tripId, String routeId, String serviceId, String tripHeadsign, Integer directionId) {}

package org.jouca.live_arrivals.records;

/**
 * Static metadata needed to turn a delta-feed stop-time update into a visit.
 *
 * <p>The feed only carries trip and stop ids; route, direction, operator and destination come
 * from one joined query against the static schedule.
 *
 * @param tripId canonical (prefixed) trip id
 * @param routeId route id of the trip
 * @param directionId direction of the trip, may be null
 * @param routeShortName published line name
 * @param agencyId operator id
 * @param destinationCode stop code of the last stop of the trip, may be null
 *
 * @author Jouca
 * @since 1.0
 */
public record TripInfo(String tripId, String routeId, Integer directionId, String routeShortName,
                       String agencyId, String destinationCode) {}

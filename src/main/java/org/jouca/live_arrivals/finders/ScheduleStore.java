package org.jouca.live_arrivals.finders;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.jouca.live_arrivals.records.Agency;
import org.jouca.live_arrivals.records.City;
import org.jouca.live_arrivals.records.Route;
import org.jouca.live_arrivals.records.Stop;
import org.jouca.live_arrivals.records.StopTime;
import org.jouca.live_arrivals.records.Translation;
import org.jouca.live_arrivals.records.Trip;
import org.jouca.live_arrivals.records.TripInfo;

/**
 * Read-only access to the static schedule.
 *
 * <p>Relations between rows are plain string references without enforced integrity, so every
 * single-row lookup returns null when the row is missing and every multi-row lookup returns an
 * empty collection. Implementations throw
 * {@link org.jouca.live_arrivals.exceptions.ScheduleStoreException} only when the store itself
 * fails.
 *
 * @author Jouca
 * @since 1.0
 */
public interface ScheduleStore {

    Agency findAgency(String agencyId);

    Route findRoute(String routeId);

    /**
     * Routes of an operator sharing a published line name, sorted by route id so that repeated
     * calls list alternatives in the same order.
     */
    List<Route> findRoutes(String agencyId, String routeShortName);

    Trip findTrip(String tripId);

    /**
     * Trips of a route, optionally restricted to one direction.
     *
     * @param directionId direction filter, or null for both directions
     */
    List<Trip> findTripsByRoute(String routeId, Integer directionId);

    /** Stop times of a trip ordered by stop sequence. */
    List<StopTime> findStopTimes(String tripId);

    Stop findStopById(String stopId);

    Stop findStopByCode(String stopCode);

    List<Stop> findStopsByIds(Collection<String> stopIds);

    /** Stops whose coordinates are exactly {@code (lat, lon)}. */
    List<Stop> findStopsAt(double lat, double lon);

    List<Stop> findStopsByName(String stopName);

    /** Stops inside a latitude/longitude bounding box, bounds included. */
    List<Stop> findStopsInBox(double minLat, double maxLat, double minLon, double maxLon);

    /**
     * Translations whose source string is one of {@code sources}.
     *
     * @param sources source strings to look up
     * @param lang language filter, or null for every language
     */
    List<Translation> findTranslations(Collection<String> sources, String lang);

    City findCity(String name);

    /**
     * Counts the distinct route licence numbers of an operator. The licence number is the part
     * of {@code route_desc} before the first {@code -}.
     */
    int countRoutes(String agencyId);

    /**
     * Resolves route, direction, operator and destination stop code for a batch of trips.
     *
     * @return trip id to metadata, without entries for unknown trips
     */
    Map<String, TripInfo> findTripInfo(Collection<String> tripIds);

    /**
     * Resolves delta-feed stop ids to schedule stop codes through the feed stop mapping table.
     *
     * @return feed stop id to stop code, without entries for unmapped stops
     */
    Map<String, String> findMappedStopCodes(Collection<String> feedStopIds);
}

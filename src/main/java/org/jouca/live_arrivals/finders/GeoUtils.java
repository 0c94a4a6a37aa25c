package org.jouca.live_arrivals.finders;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.jouca.live_arrivals.records.Stop;

/**
 * Distance helpers for stop lookups around a point.
 *
 * @author Jouca
 * @since 1.0
 */
public final class GeoUtils {
    private GeoUtils() {}

    /** Mean earth radius in metres. */
    private static final double R = 6371000.0;

    /** Metres per degree of latitude. */
    private static final double METERS_PER_DEGREE = 111320.0;

    /**
     * Great-circle distance in metres between two coordinates.
     */
    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * R * Math.asin(Math.sqrt(a));
    }

    /**
     * Finds the stops within {@code radiusMeters} of a point, nearest first.
     *
     * <p>The store is asked for a bounding box around the point, then each candidate is filtered
     * on its exact distance.
     *
     * @param store static schedule store
     * @param lat latitude of the point
     * @param lon longitude of the point
     * @param radiusMeters search radius in metres
     * @return stops inside the radius, sorted by distance
     */
    public static List<Stop> findStopsWithin(ScheduleStore store, double lat, double lon, double radiusMeters) {
        double dLat = radiusMeters / METERS_PER_DEGREE;
        double dLon = radiusMeters / (METERS_PER_DEGREE * Math.max(Math.cos(Math.toRadians(lat)), 1e-6));
        List<Stop> result = new ArrayList<>();
        for (Stop stop : store.findStopsInBox(lat - dLat, lat + dLat, lon - dLon, lon + dLon)) {
            if (stop.getStopLat() == null || stop.getStopLon() == null) {
                continue;
            }
            if (haversine(lat, lon, stop.getStopLat(), stop.getStopLon()) <= radiusMeters) {
                result.add(stop);
            }
        }
        result.sort(Comparator.comparingDouble(s -> haversine(lat, lon, s.getStopLat(), s.getStopLon())));
        return result;
    }
}

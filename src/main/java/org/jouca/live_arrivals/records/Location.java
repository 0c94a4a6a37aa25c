package org.jouca.live_arrivals.records;

/**
 * A WGS84 coordinate pair.
 *
 * @param lat latitude in decimal degrees
 * @param lon longitude in decimal degrees
 *
 * @author Jouca
 * @since 1.0
 */
public record Location(double lat, double lon) {}

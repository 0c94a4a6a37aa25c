package org.jouca.live_arrivals.records;

/**
 * A stop as published by the delta feed's own static data, before it is matched to the schedule.
 *
 * @param stopId feed-local stop id
 * @param stopCode rider-facing code, may be blank
 * @param stopName stop name, may be blank
 * @param stopLat latitude, or null when the feed has none
 * @param stopLon longitude, or null when the feed has none
 */
public record FeedStop(String stopId, String stopCode, String stopName, Double stopLat, Double stopLon) {}

package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * Static schedule information joined to a visit after decoding.
 *
 * <p>{@code destination} and {@code headsign} are null when the schedule does not know the
 * trip or stop referenced by the live data, which happens whenever the schedule is stale.
 *
 * @author Jouca
 * @since 1.0
 */
public record StaticInfo(DestinationInfo destination, AgencyInfo agency, Map<String, String> headsign) {}

package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * Destination of a visit as resolved against the static schedule.
 *
 * @param code stop code of the destination
 * @param name translations of the destination name, keyed by language code
 * @param address translated address, possibly {@link Address#EMPTY}
 * @param location destination coordinates, may be null
 *
 * @author Jouca
 * @since 1.0
 */
public record DestinationInfo(String code, Map<String, String> name, Address address, Location location) {}

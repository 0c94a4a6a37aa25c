package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * A stop along a route map, in travel order.
 *
 * @author Jouca
 * @since 1.0
 */
public record RouteStop(String stopCode, Map<String, String> name, Address address) {}

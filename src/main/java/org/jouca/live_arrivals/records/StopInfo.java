package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * Front-end description of a requested stop.
 *
 * @author Jouca
 * @since 1.0
 */
public record StopInfo(String code, Map<String, String> name, Address address, Location location) {}

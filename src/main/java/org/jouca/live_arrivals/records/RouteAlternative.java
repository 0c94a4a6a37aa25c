package org.jouca.live_arrivals.records;

/**
 * One of the routes sharing an operator and a published line name.
 *
 * @author Jouca
 * @since 1.0
 */
public record RouteAlternative(String routeId, String shortName, String longName) {}

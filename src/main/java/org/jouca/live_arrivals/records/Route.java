package org.jouca.live_arrivals.records;

/**
 * A row of the static schedule {@code routes} table.
 *
 * <p>{@code routeDesc} holds the route licence number, followed by direction and alternative
 * codes, separated by {@code -}. {@code routeLongName} has the form
 * {@code origin-town<->destination-town}.
 *
 * @author Jouca
 * @since 1.0
 */
public record Route(String routeId, String agencyId, String routeShortName, String routeLongName,
                    String routeDesc, Integer routeType) {}

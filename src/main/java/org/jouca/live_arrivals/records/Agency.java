package org.jouca.live_arrivals.records;

/**
 * A row of the static schedule {@code agency} table.
 *
 * @param agencyId  natural key, also the operator id used by the live-data sources
 * @param agencyName the agency name in the schedule's original language
 * @param agencyUrl the agency website
 *
 * @author Jouca
 * @since 1.0
 */
public record Agency(String agencyId, String agencyName, String agencyUrl) {}

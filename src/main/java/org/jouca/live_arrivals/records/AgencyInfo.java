package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * Display information for the operator of a visit.
 *
 * @param name operator name keyed by language code
 * @param url operator website, may be null
 *
 * @author Jouca
 * @since 1.0
 */
public record AgencyInfo(Map<String, String> name, String url) {}

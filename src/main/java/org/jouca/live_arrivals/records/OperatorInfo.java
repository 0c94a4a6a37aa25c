package org.jouca.live_arrivals.records;

import java.util.Map;

/**
 * Display information for an operator page.
 *
 * @param operatorId agency id
 * @param name operator name keyed by language code
 * @param url operator website
 * @param routeCount number of distinct route licences run by the operator
 *
 * @author Jouca
 * @since 1.0
 */
public record OperatorInfo(String operatorId, Map<String, String> name, String url, int routeCount) {}

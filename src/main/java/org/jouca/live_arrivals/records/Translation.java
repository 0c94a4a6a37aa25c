package org.jouca.live_arrivals.records;

/**
 * A row of the {@code translations} table: {@code transId} is the source string itself.
 *
 * @author Jouca
 * @since 1.0
 */
public record Translation(String transId, String lang, String translation) {}

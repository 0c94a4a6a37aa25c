package org.jouca.live_arrivals.records;

/**
 * Settlement name reference row, mapping an original-language place name to its official
 * transliterated name. Not part of GTFS.
 *
 * @author Jouca
 * @since 1.0
 */
public record City(String name, String englishName) {}

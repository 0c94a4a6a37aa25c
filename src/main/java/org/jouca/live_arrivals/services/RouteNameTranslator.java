package org.jouca.live_arrivals.services;

import java.util.List;

import org.jouca.live_arrivals.cache.TtlCache;

/**
 * Translates composite route long names such as
 * {@code רדינג-תל אביב יפו<->ת. מרכזית-תל אביב יפו-10}.
 *
 * <p>The name is split into origin and destination on the first known separator. Each side is
 * translated as a whole when the table has it; otherwise its stop name and town, separated by
 * {@code -}, are translated one by one. The town is left out when the stop name already names it,
 * literally or through a {@link TownSynonyms} entry.
 *
 * @author Jouca
 * @since 1.0
 */
public class RouteNameTranslator {

    /** Origin/destination separators, in the order they are tried. */
    static final List<String> SEPARATORS = List.of("<->", "<>");

    static final String OUTPUT_SEPARATOR = "<->";

    private final TranslationResolver resolver;
    private final TownSynonyms townSynonyms;
    private final TtlCache<String, String> cache;

    public RouteNameTranslator(TranslationResolver resolver, TownSynonyms townSynonyms, TtlCache<String, String> cache) {
        this.resolver = resolver;
        this.townSynonyms = townSynonyms;
        this.cache = cache;
    }

    /**
     * @param longName the route long name, may be null
     * @return the English name, or null for a null input
     */
    public String translate(String longName) {
        if (longName == null) {
            return null;
        }
        return cache.get(longName, this::translateUncached);
    }

    private String translateUncached(String longName) {
        for (String separator : SEPARATORS) {
            int index = longName.indexOf(separator);
            if (index >= 0) {
                String origin = longName.substring(0, index);
                String destination = longName.substring(index + separator.length());
                return translatePart(origin) + OUTPUT_SEPARATOR + translatePart(destination);
            }
        }
        return translatePart(longName);
    }

    String translatePart(String part) {
        String whole = resolver.translate(part, "EN");
        if (whole != null) {
            return whole;
        }

        String[] pieces = part.split("-");
        String stopName = pieces[0].strip();
        String stopTranslation = resolver.translate(stopName, "EN");
        if (stopTranslation != null) {
            stopName = stopTranslation;
        }
        if (pieces.length < 2) {
            return stopName;
        }

        String town = pieces[1].strip();
        String townTranslation = resolver.translateCity(town);
        if (townTranslation != null) {
            town = townTranslation;
        }

        if (stopName.contains(town.replace("-", "")) || stopName.contains(town)) {
            return stopName;
        }
        if (townSynonyms.matches(town, stopName)) {
            return stopName;
        }
        return stopName + "-" + town;
    }
}

package org.jouca.live_arrivals.services;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.finders.ScheduleStore;
import org.jouca.live_arrivals.records.Address;
import org.jouca.live_arrivals.records.City;
import org.jouca.live_arrivals.records.Stop;
import org.jouca.live_arrivals.records.Translation;

/**
 * Looks up translations of schedule strings.
 *
 * <p>Schedule strings sometimes write a double quote as two apostrophes while the translation
 * table uses the double quote, so both spellings are looked up. Results are cached.
 *
 * @author Jouca
 * @since 1.0
 */
public class TranslationResolver {

    /** Language of untranslated schedule strings. */
    public static final String SOURCE_LANG = "HE";

    private final ScheduleStore store;
    private final AddressParser addressParser;
    private final TtlCache<String, Map<String, String>> translationCache;
    private final TtlCache<String, Optional<String>> cityCache;

    public TranslationResolver(ScheduleStore store, AddressParser addressParser,
                               TtlCache<String, Map<String, String>> translationCache,
                               TtlCache<String, Optional<String>> cityCache) {
        this.store = store;
        this.addressParser = addressParser;
        this.translationCache = translationCache;
        this.cityCache = cityCache;
    }

    /**
     * Returns every translation of {@code source} by language.
     *
     * @param source the schedule string
     * @return language to translation, or {@code {"HE": source}} with normalized quotes when the
     *         string has no translation
     */
    public Map<String, String> translate(String source) {
        if (source == null) {
            return null;
        }
        return translationCache.get(source, key -> {
            Map<String, String> byLang = new LinkedHashMap<>();
            for (Translation translation : store.findTranslations(variants(key), null)) {
                byLang.putIfAbsent(translation.lang(), translation.translation());
            }
            if (byLang.isEmpty()) {
                byLang.put(SOURCE_LANG, normalizeQuotes(key));
            }
            return Map.copyOf(byLang);
        });
    }

    /**
     * Returns the translation of {@code source} to {@code lang}.
     *
     * @return the translation, or null when there is none
     */
    public String translate(String source, String lang) {
        if (source == null) {
            return null;
        }
        List<Translation> translations = store.findTranslations(variants(source), lang);
        return translations.isEmpty() ? null : translations.get(0).translation();
    }

    /**
     * Returns the English name of a city: its translation when the table has one, otherwise
     * the official transliteration from the city list.
     *
     * @return the English name, or null when unknown
     */
    public String translateCity(String city) {
        if (city == null || city.isEmpty()) {
            return null;
        }
        return cityCache.get(city, key -> {
            String translation = translate(key).get("EN");
            if (translation != null) {
                return Optional.of(translation);
            }
            City known = store.findCity(key);
            return Optional.ofNullable(known == null ? null : known.englishName());
        }).orElse(null);
    }

    /**
     * Returns the stop's address with its city translated when possible.
     */
    public Address translatedAddress(Stop stop) {
        Address address = stop.getAddress(addressParser::parse);
        if (address.isEmpty()) {
            return address;
        }
        String city = translateCity(address.city());
        return city == null ? address : address.withCity(city);
    }

    private static Set<String> variants(String source) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(source);
        variants.add(normalizeQuotes(source));
        return variants;
    }

    static String normalizeQuotes(String source) {
        return source.replace("''", "\"");
    }
}

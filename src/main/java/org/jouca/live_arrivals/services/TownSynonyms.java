package org.jouca.live_arrivals.services;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Table of towns whose name appears in stop names under another spelling.
 *
 * <p>Each entry maps a translated town name to a pattern; a stop name matching the pattern from
 * its first character already names the town.
 *
 * @author Jouca
 * @since 1.0
 */
public class TownSynonyms {

    private final Map<String, Pattern> patterns;

    public TownSynonyms(Map<String, Pattern> patterns) {
        this.patterns = Collections.unmodifiableMap(new HashMap<>(patterns));
    }

    /**
     * Loads the table from a UTF-8 properties resource, {@code town=regex} per line.
     *
     * @param resource classpath resource name
     * @return the table, empty when the resource does not exist
     */
    public static TownSynonyms fromResource(String resource) {
        Map<String, Pattern> patterns = new HashMap<>();
        try (InputStream in = TownSynonyms.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return new TownSynonyms(patterns);
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            for (String town : properties.stringPropertyNames()) {
                patterns.put(town, Pattern.compile(properties.getProperty(town)));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read town synonyms from " + resource, e);
        }
        return new TownSynonyms(patterns);
    }

    /**
     * Tells whether {@code stopName} already names {@code town}.
     */
    public boolean matches(String town, String stopName) {
        Pattern pattern = patterns.get(town);
        return pattern != null && pattern.matcher(stopName).lookingAt();
    }
}

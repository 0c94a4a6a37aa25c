package org.jouca.live_arrivals.finders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.jouca.live_arrivals.records.FeedStop;
import org.jouca.live_arrivals.records.Stop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches the stops of the delta feed to stops of the static schedule.
 *
 * <p>The feed publishes its own stop ids. Each feed stop is matched by the first strategy that
 * finds a schedule stop:
 * <ol>
 *   <li>{@link Strategy#CODE}: same stop code</li>
 *   <li>{@link Strategy#LOCATION}: identical coordinates</li>
 *   <li>{@link Strategy#LOCATION_FUZZY}: exactly one stop within {@value #FUZZY_RADIUS_METERS} m</li>
 *   <li>{@link Strategy#NAME}: identical name</li>
 *   <li>{@link Strategy#CLEANED_NAME}: identical name once spaces around {@code /} are trimmed
 *       and back-ticks are replaced with apostrophes</li>
 * </ol>
 * Names are not unique, so the name strategies are tried last.
 *
 * @author Jouca
 * @since 1.0
 */
public class FeedStopMatcher {
    private static final Logger logger = LoggerFactory.getLogger(FeedStopMatcher.class);

    static final double FUZZY_RADIUS_METERS = 9.0;

    /** How a feed stop was matched. */
    public enum Strategy {
        CODE,
        LOCATION,
        LOCATION_FUZZY,
        NAME,
        CLEANED_NAME
    }

    private final ScheduleStore store;

    public FeedStopMatcher(ScheduleStore store) {
        this.store = store;
    }

    /**
     * Matches every feed stop.
     *
     * @param feedStops stops read from the feed's static data
     * @return the mapping, per-strategy counts and the stops that matched nothing
     */
    public MatchResult match(List<FeedStop> feedStops) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Map<Strategy, Integer> counts = new EnumMap<>(Strategy.class);
        for (Strategy strategy : Strategy.values()) {
            counts.put(strategy, 0);
        }
        List<FeedStop> failed = new ArrayList<>();

        for (FeedStop feedStop : feedStops) {
            Match match = matchOne(feedStop);
            if (match == null) {
                failed.add(feedStop);
                continue;
            }
            mapping.put(feedStop.stopId(), match.stopId());
            counts.merge(match.strategy(), 1, Integer::sum);
        }

        logger.info("Matched {} feed stops ({}), {} failed", mapping.size(), counts, failed.size());
        if (!failed.isEmpty()) {
            logger.debug("Unmatched feed stops: {}", failed);
        }
        return new MatchResult(mapping, counts, failed);
    }

    private Match matchOne(FeedStop feedStop) {
        if (!isBlank(feedStop.stopCode())) {
            Stop stop = store.findStopByCode(feedStop.stopCode().strip());
            if (stop != null) {
                return new Match(stop.getStopId(), Strategy.CODE);
            }
        }
        if (feedStop.stopLat() != null && feedStop.stopLon() != null) {
            List<Stop> exact = store.findStopsAt(feedStop.stopLat(), feedStop.stopLon());
            if (!exact.isEmpty()) {
                return new Match(exact.get(0).getStopId(), Strategy.LOCATION);
            }
            List<Stop> nearby = GeoUtils.findStopsWithin(store, feedStop.stopLat(), feedStop.stopLon(),
                FUZZY_RADIUS_METERS);
            if (nearby.size() == 1) {
                return new Match(nearby.get(0).getStopId(), Strategy.LOCATION_FUZZY);
            } else if (nearby.size() > 1) {
                logger.debug("More than one stop around {}", feedStop);
            }
        }
        if (!isBlank(feedStop.stopName())) {
            List<Stop> byName = store.findStopsByName(feedStop.stopName());
            if (!byName.isEmpty()) {
                return new Match(byName.get(0).getStopId(), Strategy.NAME);
            }
            List<Stop> byCleanedName = store.findStopsByName(cleanName(feedStop.stopName()));
            if (!byCleanedName.isEmpty()) {
                return new Match(byCleanedName.get(0).getStopId(), Strategy.CLEANED_NAME);
            }
        }
        return null;
    }

    /**
     * Trims the parts of a {@code /}-separated name and replaces back-ticks with apostrophes.
     */
    static String cleanName(String name) {
        return List.of(name.split("/", -1)).stream()
            .map(String::strip)
            .collect(Collectors.joining("/"))
            .replace('`', '\'');
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Match(String stopId, Strategy strategy) {}

    /**
     * Outcome of a matching run.
     *
     * @param mapping feed stop id to schedule stop id, in feed order
     * @param counts number of stops matched by each strategy
     * @param failed feed stops that matched nothing
     */
    public record MatchResult(Map<String, String> mapping, Map<Strategy, Integer> counts, List<FeedStop> failed) {

        public MatchResult {
            mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
            counts = Collections.unmodifiableMap(new EnumMap<>(counts));
            failed = List.copyOf(failed);
        }
    }
}

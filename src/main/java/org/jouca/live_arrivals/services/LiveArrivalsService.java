package org.jouca.live_arrivals.services;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jouca.live_arrivals.exceptions.TooManyStopsException;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.Visit;
import org.jouca.live_arrivals.records.StaticInfo;
import org.jouca.live_arrivals.records.StopInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the aggregation engine.
 *
 * <p>A request for a set of stop codes:
 * <ul>
 *   <li>collapses duplicate codes and rejects requests above the configured limit</li>
 *   <li>queries the stop-monitoring source, and the delta feed on its active days</li>
 *   <li>merges both answers, deduplicating identical visits</li>
 *   <li>attaches the static schedule information of every visit</li>
 *   <li>optionally keeps only some published line names</li>
 * </ul>
 * On days where both sources are queried, one source failing to answer is reported in the
 * response errors as long as the other one answered.
 *
 * @author Jouca
 * @since 1.0
 */
public class LiveArrivalsService {
    private static final Logger logger = LoggerFactory.getLogger(LiveArrivalsService.class);

    private final RequestBatcher siriBatcher;
    private final RequestBatcher deltaFeedBatcher;
    private final ResponseMerger merger;
    private final ScheduleCrossReferencer crossReferencer;
    private final Set<DayOfWeek> deltaFeedDays;
    private final int maxStops;
    private final int maxVisits;
    private final Clock clock;

    /**
     * @param siriBatcher batcher of the stop-monitoring source
     * @param deltaFeedBatcher batcher of the delta feed, or null when it is not configured
     * @param merger merges the answers of both sources
     * @param crossReferencer resolves static schedule information
     * @param deltaFeedDays days on which the delta feed is queried
     * @param maxStops maximum number of distinct stop codes per request
     * @param maxVisits maximum number of visits per stop asked to the stop-monitoring source
     * @param clock gives the current day in the service zone
     */
    public LiveArrivalsService(RequestBatcher siriBatcher, RequestBatcher deltaFeedBatcher, ResponseMerger merger,
                               ScheduleCrossReferencer crossReferencer, Set<DayOfWeek> deltaFeedDays,
                               int maxStops, int maxVisits, Clock clock) {
        this.siriBatcher = Objects.requireNonNull(siriBatcher, "siriBatcher");
        this.deltaFeedBatcher = deltaFeedBatcher;
        this.merger = merger;
        this.crossReferencer = crossReferencer;
        this.deltaFeedDays = deltaFeedDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(deltaFeedDays);
        this.maxStops = maxStops;
        this.maxVisits = maxVisits;
        this.clock = clock;
    }

    /**
     * Returns the enriched arrivals of {@code stopCodes}.
     *
     * @param stopCodes requested stop codes, in display order
     * @param lineNames published line names to keep, or null/empty for all
     * @return visits keyed by exactly the distinct requested stop codes
     * @throws TooManyStopsException when more than the allowed number of stop codes is asked, duplicates included
     * @throws TransportException when no source could answer
     */
    public AggregatedResponse getArrivals(Collection<String> stopCodes, Set<String> lineNames) {
        if (stopCodes.size() > maxStops) {
            throw new TooManyStopsException(maxStops);
        }
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(stopCodes));

        AggregatedResponse result;
        if (isDeltaFeedDay()) {
            result = requestBoth(requested);
        } else {
            result = siriBatcher.request(requested, maxVisits);
        }

        enrich(result);
        if (lineNames != null && !lineNames.isEmpty()) {
            result.filterLines(lineNames);
        }
        return result;
    }

    /**
     * Describes each known stop code, skipping unknown ones.
     */
    public Map<String, StopInfo> describeStops(Collection<String> stopCodes) {
        Map<String, StopInfo> result = new LinkedHashMap<>();
        for (String stopCode : new LinkedHashSet<>(stopCodes)) {
            StopInfo info = crossReferencer.describeStop(stopCode);
            if (info != null) {
                result.put(stopCode, info);
            }
        }
        return result;
    }

    public ScheduleCrossReferencer getCrossReferencer() {
        return crossReferencer;
    }

    boolean isDeltaFeedDay() {
        return deltaFeedBatcher != null && deltaFeedDays.contains(LocalDate.now(clock).getDayOfWeek());
    }

    private AggregatedResponse requestBoth(List<String> requested) {
        AggregatedResponse siri = null;
        AggregatedResponse deltaFeed = null;
        TransportException siriFailure = null;
        TransportException deltaFeedFailure = null;
        try {
            siri = siriBatcher.request(requested, maxVisits);
        } catch (TransportException e) {
            logger.warn("Stop-monitoring source failed, relying on the delta feed: {}", e.getMessage());
            siriFailure = e;
        }
        try {
            deltaFeed = deltaFeedBatcher.request(requested, maxVisits);
        } catch (TransportException e) {
            logger.warn("Delta feed failed: {}", e.getMessage());
            deltaFeedFailure = e;
        }

        if (siri == null && deltaFeed == null) {
            throw siriFailure;
        }
        AggregatedResponse result = siri != null ? siri : deltaFeed;
        if (siri != null && deltaFeed != null) {
            merger.merge(result, deltaFeed);
        }
        TransportException failure = siriFailure != null ? siriFailure : deltaFeedFailure;
        if (failure != null) {
            result.addError(RequestBatcher.failureMessage(failure));
        }
        return result;
    }

    private void enrich(AggregatedResponse response) {
        Map<List<String>, StaticInfo> resolved = new HashMap<>();
        for (List<Visit> visits : response.getVisits().values()) {
            for (Visit visit : visits) {
                List<String> key = Arrays.asList(visit.getTripId(), visit.getDestinationId(), visit.getOperatorId());
                StaticInfo info = resolved.computeIfAbsent(key, k -> crossReferencer.resolve(visit));
                response.setStaticInfo(visit, info);
            }
        }
    }
}

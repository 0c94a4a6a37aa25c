package org.jouca.live_arrivals.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jouca.live_arrivals.records.AgencyInfo;
import org.jouca.live_arrivals.records.DestinationInfo;
import org.jouca.live_arrivals.records.Location;
import org.jouca.live_arrivals.records.StaticInfo;

/**
 * Real-time visits for a set of requested stop codes.
 *
 * <p>Every requested stop code is a key of {@link #getVisits()}, even when no vehicle is
 * expected: a missing key never means "no data". Visits keep the order in which the source
 * delivered them.
 *
 * <p>Static schedule information is kept in a map owned by this response and joined to the
 * visits in {@link #toMap()}. The visits themselves may be shared with the cache.
 *
 * <p>This class is not thread-safe; a response belongs to a single request.
 *
 * @author Jouca
 * @since 1.0
 */
public class AggregatedResponse {

    private final Map<String, List<Visit>> visits = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<Visit, StaticInfo> staticInfo = new HashMap<>();
    private OffsetDateTime timestamp;

    /**
     * Creates an empty response with one empty visit list per requested stop code.
     *
     * @param requestedStopCodes the stop codes of the request, duplicates are collapsed
     * @param timestamp the response timestamp, may be null
     */
    public AggregatedResponse(Collection<String> requestedStopCodes, OffsetDateTime timestamp) {
        for (String stopCode : requestedStopCodes) {
            visits.putIfAbsent(stopCode, new ArrayList<>());
        }
        this.timestamp = timestamp;
    }

    /**
     * Appends a visit to the list of its stop.
     *
     * @param visit the decoded visit
     * @return false when the visit belongs to a stop that was not requested and was ignored
     */
    public boolean addVisit(Visit visit) {
        List<Visit> list = visits.get(visit.getStopCode());
        if (list == null) {
            return false;
        }
        list.add(visit);
        return true;
    }

    /**
     * Replaces the visits of a stop, typically with visits read from the cache.
     */
    public void putVisits(String stopCode, List<Visit> stopVisits) {
        visits.put(stopCode, new ArrayList<>(stopVisits));
    }

    public void addError(String error) {
        errors.add(error);
    }

    /**
     * Merges another response into this one.
     *
     * <p>Errors are concatenated. For a stop known to both responses the visits of {@code other}
     * are appended in their order, skipping any visit equal to one already present. A stop only
     * known to {@code other} adopts its list as is. Enrichment results are carried over, and the
     * timestamp is taken from {@code other} only when this response has none.
     *
     * @param other the response to merge, left unchanged
     */
    public void append(AggregatedResponse other) {
        errors.addAll(other.errors);
        for (Map.Entry<String, List<Visit>> entry : other.visits.entrySet()) {
            List<Visit> existing = visits.get(entry.getKey());
            if (existing == null) {
                visits.put(entry.getKey(), new ArrayList<>(entry.getValue()));
                continue;
            }
            Set<Visit> seen = new LinkedHashSet<>(existing);
            for (Visit visit : entry.getValue()) {
                if (seen.add(visit)) {
                    existing.add(visit);
                }
            }
        }
        other.staticInfo.forEach(staticInfo::putIfAbsent);
        if (timestamp == null) {
            timestamp = other.timestamp;
        }
    }

    /**
     * Keeps only visits whose published line name is in {@code lineNames}. Stop keys are kept.
     */
    public void filterLines(Set<String> lineNames) {
        for (List<Visit> list : visits.values()) {
            list.removeIf(visit -> !lineNames.contains(visit.getLineName()));
        }
    }

    public void setStaticInfo(Visit visit, StaticInfo info) {
        staticInfo.put(visit, info);
    }

    public StaticInfo getStaticInfo(Visit visit) {
        return staticInfo.get(visit);
    }

    /** Requested stop codes mapped to their visits, in request order. */
    public Map<String, List<Visit>> getVisits() {
        return Collections.unmodifiableMap(visits);
    }

    public List<Visit> getVisits(String stopCode) {
        List<Visit> list = visits.get(stopCode);
        return list == null ? null : Collections.unmodifiableList(list);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(OffsetDateTime timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Serializes the response for the front end:
     * {@code {errors: [..] | null, timestamp: string, visits: {stop_code: [visit]}}}.
     * Each visit carries {@code static_info: {route: {...}}} when it was enriched.
     *
     * @return an ordered map ready for JSON serialization
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("errors", errors.isEmpty() ? null : new ArrayList<>(errors));
        out.put("timestamp", timestamp == null ? null : timestamp.toString());
        Map<String, Object> visitsOut = new LinkedHashMap<>();
        for (Map.Entry<String, List<Visit>> entry : visits.entrySet()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (Visit visit : entry.getValue()) {
                Map<String, Object> visitMap = visit.toMap();
                StaticInfo info = staticInfo.get(visit);
                visitMap.put("static_info", info == null ? null : Map.of("route", staticInfoToMap(info)));
                list.add(visitMap);
            }
            visitsOut.put(entry.getKey(), list);
        }
        out.put("visits", visitsOut);
        return out;
    }

    private static Map<String, Object> staticInfoToMap(StaticInfo info) {
        Map<String, Object> out = new LinkedHashMap<>();
        DestinationInfo destination = info.destination();
        if (destination != null) {
            Map<String, Object> dest = new LinkedHashMap<>();
            dest.put("code", destination.code());
            dest.put("name", destination.name());
            dest.put("address", destination.address());
            Location location = destination.location();
            dest.put("location", location == null ? null : Map.of("lat", location.lat(), "lon", location.lon()));
            out.put("destination", dest);
        } else {
            out.put("destination", null);
        }
        AgencyInfo agency = info.agency();
        if (agency != null) {
            Map<String, Object> agencyOut = new LinkedHashMap<>();
            agencyOut.put("name", agency.name());
            agencyOut.put("url", agency.url());
            out.put("agency", agencyOut);
        } else {
            out.put("agency", null);
        }
        out.put("headsign", info.headsign());
        return out;
    }
}

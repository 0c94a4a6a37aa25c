package org.jouca.live_arrivals.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jouca.live_arrivals.finders.GeoUtils;
import org.jouca.live_arrivals.finders.ScheduleStore;
import org.jouca.live_arrivals.model.Visit;
import org.jouca.live_arrivals.records.Agency;
import org.jouca.live_arrivals.records.AgencyInfo;
import org.jouca.live_arrivals.records.DestinationInfo;
import org.jouca.live_arrivals.records.OperatorInfo;
import org.jouca.live_arrivals.records.Route;
import org.jouca.live_arrivals.records.RouteAlternative;
import org.jouca.live_arrivals.records.RouteStop;
import org.jouca.live_arrivals.records.StaticInfo;
import org.jouca.live_arrivals.records.Stop;
import org.jouca.live_arrivals.records.StopInfo;
import org.jouca.live_arrivals.records.StopTime;
import org.jouca.live_arrivals.records.Trip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins live visits and stop codes against the static schedule.
 *
 * <p>The destination of a visit is resolved by the first rule that succeeds:
 * <ol>
 *   <li>the last stop, by stop sequence, of the visit's trip; the trip headsign is used when
 *       it is not empty</li>
 *   <li>the stop whose code is the visit's destination id; there is no headsign then</li>
 *   <li>nothing: the live data referenced a trip and a stop the schedule does not know, which
 *       happens when the schedule is out of date</li>
 * </ol>
 * Missing schedule rows never raise; they give null fields.
 *
 * @author Jouca
 * @since 1.0
 */
public class ScheduleCrossReferencer {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleCrossReferencer.class);

    private final ScheduleStore store;
    private final TranslationResolver translations;
    private final RouteNameTranslator routeNames;
    private final OperatorDirectory operators;

    public ScheduleCrossReferencer(ScheduleStore store, TranslationResolver translations,
                                   RouteNameTranslator routeNames, OperatorDirectory operators) {
        this.store = store;
        this.translations = translations;
        this.routeNames = routeNames;
        this.operators = operators;
    }

    /**
     * Resolves the destination, headsign and operator of a visit.
     *
     * @param visit a decoded visit
     * @return the static information, never null
     */
    public StaticInfo resolve(Visit visit) {
        Stop destination = null;
        Map<String, String> headsign = null;

        Trip trip = visit.getTripId() == null ? null : store.findTrip(visit.getTripId());
        if (trip != null) {
            destination = lastStop(trip);
            if (trip.tripHeadsign() != null && !trip.tripHeadsign().isEmpty()) {
                headsign = translations.translate(trip.tripHeadsign());
            }
        }
        if (destination == null && visit.getDestinationId() != null) {
            destination = store.findStopByCode(visit.getDestinationId());
        }
        if (destination == null) {
            logger.debug("No schedule destination for trip {} / stop {}", visit.getTripId(), visit.getDestinationId());
        }

        return new StaticInfo(destinationInfo(destination), agencyInfo(visit.getOperatorId()), headsign);
    }

    /**
     * Describes a stop for display.
     *
     * @param stopCode rider-facing stop code
     * @return the stop's translated name, address and location, or null for an unknown code
     */
    public StopInfo describeStop(String stopCode) {
        Stop stop = store.findStopByCode(stopCode);
        return stop == null ? null : stopInfo(stop);
    }

    /**
     * Describes an operator.
     *
     * @param operatorId agency id
     * @return the operator's names, URL and number of routes, or null for an unknown agency
     */
    public OperatorInfo describeOperator(String operatorId) {
        Agency agency = store.findAgency(operatorId);
        if (agency == null) {
            return null;
        }
        return new OperatorInfo(operatorId, agencyName(agency, operatorId), agency.agencyUrl(),
            store.countRoutes(operatorId));
    }

    /**
     * Lists the routes of an operator published under one line name, sorted by route id.
     */
    public List<RouteAlternative> routeAlternatives(String operatorId, String shortName) {
        List<RouteAlternative> alternatives = new ArrayList<>();
        for (Route route : store.findRoutes(operatorId, shortName)) {
            alternatives.add(new RouteAlternative(route.routeId(), route.routeShortName(),
                routeNames.translate(route.routeLongName())));
        }
        return alternatives;
    }

    /**
     * Lists the stops of a route in travel order, taken from the first trip found.
     *
     * @param routeId the route
     * @param directionId direction to follow, or null for any
     * @return the ordered stops, empty when the route has no trip
     */
    public List<RouteStop> routeStops(String routeId, Integer directionId) {
        List<Trip> trips = store.findTripsByRoute(routeId, directionId);
        if (trips.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> sequence = new HashMap<>();
        for (StopTime stopTime : store.findStopTimes(trips.get(0).tripId())) {
            sequence.putIfAbsent(stopTime.stopId(), stopTime.stopSequence());
        }
        List<Stop> stops = new ArrayList<>(store.findStopsByIds(sequence.keySet()));
        stops.sort(Comparator.comparingInt(stop -> sequence.get(stop.getStopId())));

        List<RouteStop> result = new ArrayList<>();
        for (Stop stop : stops) {
            result.add(new RouteStop(stop.getStopCode(), translations.translate(stop.getStopName()),
                translations.translatedAddress(stop)));
        }
        return result;
    }

    /**
     * Lists the stops within {@code radiusMeters} of a point, nearest first.
     */
    public List<StopInfo> nearbyStops(double lat, double lon, double radiusMeters) {
        List<StopInfo> result = new ArrayList<>();
        for (Stop stop : GeoUtils.findStopsWithin(store, lat, lon, radiusMeters)) {
            result.add(stopInfo(stop));
        }
        return result;
    }

    private Stop lastStop(Trip trip) {
        StopTime last = null;
        for (StopTime stopTime : store.findStopTimes(trip.tripId())) {
            if (last == null || stopTime.stopSequence() > last.stopSequence()) {
                last = stopTime;
            }
        }
        return last == null ? null : store.findStopById(last.stopId());
    }

    private DestinationInfo destinationInfo(Stop stop) {
        if (stop == null) {
            return null;
        }
        return new DestinationInfo(stop.getStopCode(), translations.translate(stop.getStopName()),
            translations.translatedAddress(stop), stop.getLocation());
    }

    private StopInfo stopInfo(Stop stop) {
        return new StopInfo(stop.getStopCode(), translations.translate(stop.getStopName()),
            translations.translatedAddress(stop), stop.getLocation());
    }

    private AgencyInfo agencyInfo(String operatorId) {
        if (operatorId == null) {
            return null;
        }
        Agency agency = store.findAgency(operatorId);
        if (agency == null) {
            String englishName = operators.englishName(operatorId);
            return englishName == null ? null : new AgencyInfo(Map.of("EN", englishName), null);
        }
        return new AgencyInfo(agencyName(agency, operatorId), agency.agencyUrl());
    }

    private Map<String, String> agencyName(Agency agency, String operatorId) {
        Map<String, String> name = new LinkedHashMap<>();
        name.put("HE", agency.agencyName());
        String englishName = operators.englishName(operatorId);
        if (englishName != null) {
            name.put("EN", englishName);
        }
        return name;
    }
}

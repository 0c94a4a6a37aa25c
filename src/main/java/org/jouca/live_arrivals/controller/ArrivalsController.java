package org.jouca.live_arrivals.controller;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.records.OperatorInfo;
import org.jouca.live_arrivals.records.RouteAlternative;
import org.jouca.live_arrivals.records.RouteStop;
import org.jouca.live_arrivals.records.StopInfo;
import org.jouca.live_arrivals.services.LiveArrivalsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for live arrivals and the static schedule lookups that go with them.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /arrivals/{stopCodes}}: arrivals at one or more {@code +}-separated stops,
 *       optionally filtered by published line names</li>
 *   <li>{@code GET /stops/nearby}: stops around a point</li>
 *   <li>{@code GET /operators/{id}}: operator names, URL and route count</li>
 *   <li>{@code GET /operators/{id}/routes/{shortName}}: routes published under a line name with
 *       their stops</li>
 * </ul>
 *
 * @author Jouca
 * @since 1.0
 */
@RestController
public class ArrivalsController {

    private final LiveArrivalsService service;

    public ArrivalsController(LiveArrivalsService service) {
        this.service = service;
    }

    /**
     * Returns the arrivals at the requested stops.
     *
     * <p><b>Example usage:</b></p>
     * <pre>
     * GET /arrivals/21470+21471?filter=18,25
     * </pre>
     *
     * @param stopCodes {@code +}-separated stop codes
     * @param filter comma-separated published line names to keep, optional
     * @return the aggregated response with a {@code stops_info} entry describing each known stop
     */
    @GetMapping("/arrivals/{stopCodes}")
    public ResponseEntity<Map<String, Object>> getArrivals(@PathVariable String stopCodes,
                                                           @RequestParam(required = false) String filter) {
        List<String> codes = split(stopCodes, "\\+");
        if (codes.isEmpty()) {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        Set<String> lineNames = filter == null ? null : new HashSet<>(split(filter, ","));

        AggregatedResponse response = service.getArrivals(codes, lineNames);
        Map<String, Object> body = response.toMap();
        body.put("stops_info", service.describeStops(codes));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stops/nearby")
    public ResponseEntity<List<StopInfo>> getNearbyStops(@RequestParam double lat, @RequestParam double lon,
                                                         @RequestParam(defaultValue = "200") double radius) {
        return ResponseEntity.ok(service.getCrossReferencer().nearbyStops(lat, lon, radius));
    }

    @GetMapping("/operators/{operatorId}")
    public ResponseEntity<OperatorInfo> getOperator(@PathVariable String operatorId) {
        OperatorInfo info = service.getCrossReferencer().describeOperator(operatorId);
        if (info == null) {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }
        return ResponseEntity.ok(info);
    }

    /**
     * Returns the alternatives of a line and the stops of each, in travel order.
     *
     * @param operatorId agency id
     * @param shortName published line name
     * @param direction direction id to follow, optional
     * @return one entry per route, 404 when the operator has no such line
     */
    @GetMapping("/operators/{operatorId}/routes/{shortName}")
    public ResponseEntity<List<Map<String, Object>>> getRoutes(@PathVariable String operatorId,
                                                               @PathVariable String shortName,
                                                               @RequestParam(required = false) Integer direction) {
        List<RouteAlternative> alternatives = service.getCrossReferencer().routeAlternatives(operatorId, shortName);
        if (alternatives.isEmpty()) {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }
        List<Map<String, Object>> body = alternatives.stream()
            .map(route -> {
                List<RouteStop> stops = service.getCrossReferencer().routeStops(route.routeId(), direction);
                return Map.<String, Object>of("route", route, "stops", stops);
            })
            .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    private static List<String> split(String value, String separator) {
        return Arrays.stream(value.split(separator))
            .map(String::strip)
            .filter(part -> !part.isEmpty())
            .collect(Collectors.toList());
    }
}

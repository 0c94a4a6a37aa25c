package org.jouca.live_arrivals.model;

import org.jouca.live_arrivals.records.AgencyInfo;
import org.jouca.live_arrivals.records.StaticInfo;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AggregatedResponse class.
 * 
 * Tests key handling, merging, line filtering and serialization.
 */
class AggregatedResponseTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-18T08:00:05+02:00");

    @Test
    void testEveryRequestedStopIsAKey() {
        AggregatedResponse response = new AggregatedResponse(List.of("1", "2", "2", "3"), NOW);

        assertEquals(List.of("1", "2", "3"), List.copyOf(response.getVisits().keySet()));
        assertTrue(response.getVisits("2").isEmpty());
        assertNull(response.getVisits("4"));
    }

    @Test
    void testUnrequestedVisitIsIgnored() {
        AggregatedResponse response = new AggregatedResponse(List.of("1"), NOW);

        assertTrue(response.addVisit(visit("1", "18", 4)));
        assertFalse(response.addVisit(visit("9", "18", 4)));
        assertEquals(Set.of("1"), response.getVisits().keySet());
    }

    @Test
    void testAppendSkipsDuplicates() {
        AggregatedResponse target = new AggregatedResponse(List.of("1"), NOW);
        target.addVisit(visit("1", "18", 4));

        AggregatedResponse other = new AggregatedResponse(List.of("1"), null);
        other.addVisit(visit("1", "18", 4));
        other.addVisit(visit("1", "25", 9));
        other.addError("boom");

        target.append(other);
        target.append(other);

        assertEquals(2, target.getVisits("1").size());
        assertEquals("25", target.getVisits("1").get(1).getLineName());
        assertEquals(List.of("boom", "boom"), target.getErrors());
        assertEquals(NOW, target.getTimestamp());
    }

    @Test
    void testAppendAdoptsMissingStopsAndTimestamp() {
        AggregatedResponse target = new AggregatedResponse(List.of("1"), null);
        AggregatedResponse other = new AggregatedResponse(List.of("2"), NOW);
        other.addVisit(visit("2", "18", 4));

        target.append(other);

        assertEquals(1, target.getVisits("2").size());
        assertEquals(NOW, target.getTimestamp());
    }

    @Test
    void testFilterLinesKeepsKeys() {
        AggregatedResponse response = new AggregatedResponse(List.of("1", "2"), NOW);
        response.addVisit(visit("1", "18", 4));
        response.addVisit(visit("1", "25", 6));
        response.addVisit(visit("2", "25", 8));

        response.filterLines(Set.of("18"));

        assertEquals(1, response.getVisits("1").size());
        assertTrue(response.getVisits("2").isEmpty());
        assertTrue(response.getVisits().containsKey("2"));
    }

    @Test
    void testToMap() {
        AggregatedResponse response = new AggregatedResponse(List.of("1", "2"), NOW);
        Visit visit = visit("1", "18", 4);
        response.addVisit(visit);
        response.setStaticInfo(visit, new StaticInfo(null, new AgencyInfo(Map.of("HE", "דן"), "http://www.dan.co.il"),
            Map.of("EN", "Holon")));

        Map<String, Object> map = response.toMap();
        assertNull(map.get("errors"));
        assertEquals("2025-03-18T08:00:05+02:00", map.get("timestamp"));

        @SuppressWarnings("unchecked")
        Map<String, List<Map<String, Object>>> visits = (Map<String, List<Map<String, Object>>>) map.get("visits");
        assertEquals(Set.of("1", "2"), visits.keySet());
        assertTrue(visits.get("2").isEmpty());

        @SuppressWarnings("unchecked")
        Map<String, Object> route = (Map<String, Object>) ((Map<String, Object>) visits.get("1").get(0)
            .get("static_info")).get("route");
        assertNull(route.get("destination"));
        assertEquals(Map.of("EN", "Holon"), route.get("headsign"));

        response.addError("x");
        assertEquals(List.of("x"), response.toMap().get("errors"));
    }

    @Test
    void testStaticInfoDoesNotLeakToEqualVisitsOfOtherResponses() {
        Visit visit = visit("1", "18", 4);
        AggregatedResponse first = new AggregatedResponse(List.of("1"), NOW);
        AggregatedResponse second = new AggregatedResponse(List.of("1"), NOW);
        first.addVisit(visit);
        second.addVisit(visit);

        first.setStaticInfo(visit, new StaticInfo(null, null, null));

        assertNotNull(first.getStaticInfo(visit));
        assertNull(second.getStaticInfo(visit));
    }

    private static Visit visit(String stopCode, String lineName, int minutes) {
        return Visit.builder(Visit.PRODUCER_SIRI)
            .timestamp(NOW)
            .stopCode(stopCode)
            .routeId("r" + lineName)
            .lineName(lineName)
            .vehicleRef("v" + lineName)
            .eta(NOW.plusMinutes(minutes))
            .build();
    }
}

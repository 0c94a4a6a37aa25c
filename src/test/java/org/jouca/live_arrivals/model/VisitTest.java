package org.jouca.live_arrivals.model;

import org.jouca.live_arrivals.records.Location;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Visit class.
 * 
 * Tests equality rules and serialization.
 */
class VisitTest {

    private static final OffsetDateTime ETA = OffsetDateTime.parse("2025-03-18T08:04:00+02:00");
    private static final OffsetDateTime RECORDED = OffsetDateTime.parse("2025-03-18T08:00:01+02:00");

    @Test
    void testEqualityIgnoresRawPayload() {
        Visit a = base(Visit.PRODUCER_SIRI).raw(JsonNodeFactory.instance.textNode("first")).build();
        Visit b = base(Visit.PRODUCER_SIRI).raw(JsonNodeFactory.instance.textNode("second")).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testEqualityIgnoresDisplayFields() {
        Visit a = base(Visit.PRODUCER_SIRI).lineName("18").status("onTime").build();
        Visit b = base(Visit.PRODUCER_SIRI).lineName("18a").status("delayed").build();

        assertEquals(a, b);
    }

    @Test
    void testSameInstantInAnotherOffsetIsEqual() {
        Visit a = base(Visit.PRODUCER_SIRI).build();
        Visit b = base(Visit.PRODUCER_SIRI).eta(ETA.withOffsetSameInstant(ZoneOffset.UTC)).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testProducerTakesPartInEquality() {
        assertNotEquals(base(Visit.PRODUCER_SIRI).build(), base(Visit.PRODUCER_GTFS_RT).build());
    }

    @Test
    void testKeyFieldsTakePartInEquality() {
        Visit reference = base(Visit.PRODUCER_SIRI).build();

        assertNotEquals(reference, base(Visit.PRODUCER_SIRI).vehicleRef("other").build());
        assertNotEquals(reference, base(Visit.PRODUCER_SIRI).eta(ETA.plusMinutes(1)).build());
        assertNotEquals(reference, base(Visit.PRODUCER_SIRI).directionId("1").build());
        assertNotEquals(reference, base(Visit.PRODUCER_SIRI).timestamp(null).build());
    }

    @Test
    void testBuilderRequiresProducer() {
        assertThrows(NullPointerException.class, () -> Visit.builder(null));
    }

    @Test
    void testToMap() {
        Visit visit = base(Visit.PRODUCER_SIRI).location(new Location(32.01, 34.77)).build();

        Map<String, Object> map = visit.toMap();
        assertEquals("SIRI", map.get("producer"));
        assertEquals("21470", map.get("stop_code"));
        assertEquals("1001", map.get("line_id"));
        assertEquals("1001", map.get("route_id"));
        assertEquals("2025-03-18T08:04+02:00", map.get("eta"));
        assertNull(map.get("departed"));
        assertEquals(Map.of("lat", 32.01, "lon", 34.77), map.get("location"));
        assertTrue(map.containsKey("trip_id"));
    }

    private static Visit.Builder base(String producer) {
        return Visit.builder(producer)
            .timestamp(RECORDED)
            .stopCode("21470")
            .routeId("1001")
            .directionId("0")
            .vehicleRef("7421")
            .eta(ETA);
    }
}

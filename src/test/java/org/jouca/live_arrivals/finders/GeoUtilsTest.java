package org.jouca.live_arrivals.finders;

import org.jouca.live_arrivals.records.Stop;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GeoUtils class.
 * 
 * Tests distance computation and radius searches.
 */
class GeoUtilsTest {

    @Test
    void testHaversineSamePoint() {
        assertEquals(0.0, GeoUtils.haversine(32.0, 34.8, 32.0, 34.8), 1e-9);
    }

    @Test
    void testHaversineOneDegreeOfLatitude() {
        assertEquals(111195, GeoUtils.haversine(32.0, 34.8, 33.0, 34.8), 100);
    }

    @Test
    void testFindStopsWithinSortsNearestFirst() {
        Stop far = stop("far", 32.0015, 34.8);      // ~167 m
        Stop near = stop("near", 32.0005, 34.8);    // ~56 m
        Stop corner = stop("corner", 32.0017, 34.802); // inside the box, ~260 m
        Stop unknown = new Stop("nowhere", "nowhere", "x", null, null, null);

        ScheduleStore store = mock(ScheduleStore.class);
        when(store.findStopsInBox(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
            .thenReturn(List.of(far, corner, near, unknown));

        List<Stop> result = GeoUtils.findStopsWithin(store, 32.0, 34.8, 200);

        assertEquals(List.of("near", "far"), result.stream().map(Stop::getStopId).collect(Collectors.toList()));
    }

    private static Stop stop(String id, double lat, double lon) {
        return new Stop(id, id, id, null, lat, lon);
    }
}

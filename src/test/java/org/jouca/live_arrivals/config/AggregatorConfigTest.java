package org.jouca.live_arrivals.config;

import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AggregatorConfig class.
 */
class AggregatorConfigTest {

    @Test
    void testActiveDaysUseIsoNumbering() {
        assertEquals(Set.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY), AggregatorConfig.activeDays(new int[] {5, 6}));
        assertTrue(AggregatorConfig.activeDays(new int[0]).isEmpty());
    }

    @Test
    void testInvalidDayIsRejected() {
        assertThrows(DateTimeException.class, () -> AggregatorConfig.activeDays(new int[] {8}));
    }
}

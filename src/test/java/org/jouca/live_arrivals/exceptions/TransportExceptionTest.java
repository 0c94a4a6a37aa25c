package org.jouca.live_arrivals.exceptions;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransportException class.
 * 
 * Tests message, cause and stop code handling.
 */
class TransportExceptionTest {

    @Test
    void testConstructorWithMessage() {
        TransportException exception = new TransportException("Connection refused");

        assertEquals("Connection refused", exception.getMessage());
        assertNull(exception.getCause());
        assertTrue(exception.getStopCodes().isEmpty());
    }

    @Test
    void testConstructorWithStopCodes() {
        IOException cause = new IOException("reset");
        List<String> codes = new ArrayList<>(List.of("1", "2"));
        TransportException exception = new TransportException("failed", codes, cause);
        codes.add("3");

        assertEquals(List.of("1", "2"), exception.getStopCodes());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testNullStopCodesBecomeEmpty() {
        assertTrue(new TransportException("failed", null, null).getStopCodes().isEmpty());
    }

    @Test
    void testExceptionIsUnchecked() {
        assertThrows(TransportException.class, () -> {
            throw new TransportException("boom", new RuntimeException());
        });
    }
}

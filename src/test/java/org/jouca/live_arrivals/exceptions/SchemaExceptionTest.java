package org.jouca.live_arrivals.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SchemaException class.
 */
class SchemaExceptionTest {

    @Test
    void testConstructorWithMessage() {
        SchemaException exception = new SchemaException("Missing Answer");

        assertEquals("Missing Answer", exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    void testConstructorWithCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad date");
        SchemaException exception = new SchemaException("Invalid timestamp", cause);

        assertEquals("Invalid timestamp", exception.getMessage());
        assertSame(cause, exception.getCause());
    }
}

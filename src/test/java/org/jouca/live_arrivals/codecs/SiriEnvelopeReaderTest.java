package org.jouca.live_arrivals.codecs;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SiriEnvelopeReader class.
 * 
 * Tests the XML to tree conversion and JSON passthrough.
 */
class SiriEnvelopeReaderTest {

    private SiriEnvelopeReader reader;

    @BeforeEach
    void setUp() {
        reader = new SiriEnvelopeReader(new ObjectMapper());
    }

    @Test
    void testRepeatedElementsBecomeArrays() {
        JsonNode doc = reader.read("<root><a:item>1</a:item><a:item>2</a:item><a:single>3</a:single></root>");

        JsonNode root = doc.get("root");
        assertTrue(root.get("a:item").isArray());
        assertEquals(2, root.get("a:item").size());
        assertEquals("3", root.get("a:single").asText());
    }

    @Test
    void testAttributesAndText() {
        JsonNode doc = reader.read("<root xmlns:x=\"urn:x\"><x:ref version=\"2\">abc</x:ref><x:empty/></root>");

        JsonNode root = doc.get("root");
        assertEquals("urn:x", root.get("@xmlns:x").asText());
        assertEquals("2", root.get("x:ref").get("@version").asText());
        assertEquals("abc", root.get("x:ref").get("#text").asText());
        assertTrue(root.get("x:empty").isNull());
    }

    @Test
    void testJsonIsParsedAsIs() {
        JsonNode doc = reader.read("  {\"Siri\": {\"ServiceDelivery\": {}}}");

        assertTrue(doc.path("Siri").path("ServiceDelivery").isObject());
    }

    @Test
    void testMalformedPayloadsAreRejected() {
        assertThrows(SchemaException.class, () -> reader.read("<root><unclosed></root>"));
        assertThrows(SchemaException.class, () -> reader.read("{\"Siri\": "));
        assertThrows(SchemaException.class, () -> reader.read("   "));
        assertThrows(SchemaException.class, () -> reader.read(null));
    }

    @Test
    void testDoctypeIsRejected() {
        String payload = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY e \"boom\">]><r>&e;</r>";

        assertThrows(SchemaException.class, () -> reader.read(payload));
    }
}

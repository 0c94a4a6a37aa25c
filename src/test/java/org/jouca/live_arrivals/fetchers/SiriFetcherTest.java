package org.jouca.live_arrivals.fetchers;

import org.jouca.live_arrivals.exceptions.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SiriFetcher class.
 * 
 * Tests the SOAP transport against a local HTTP server.
 */
class SiriFetcherTest {

    private HttpServer server;
    private String url;
    private final AtomicReference<String> received = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = "<answer>ok</answer>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/gzip", exchange -> {
            exchange.getRequestBody().readAllBytes();
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
                gzip.write("<answer>compressed</answer>".getBytes(StandardCharsets.UTF_8));
            }
            exchange.getResponseHeaders().add("Content-Encoding", "gzip");
            exchange.sendResponseHeaders(200, buffer.size());
            try (OutputStream out = exchange.getResponseBody()) {
                buffer.writeTo(out);
            }
        });
        server.createContext("/error", exchange -> {
            exchange.getRequestBody().readAllBytes();
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testPostReturnsBody() {
        SiriFetcher fetcher = new SiriFetcher(url + "/ok", 2000, 2000);

        assertEquals("<answer>ok</answer>", fetcher.post("<request/>", List.of("1")));
        assertEquals("<request/>", received.get());
    }

    @Test
    void testGzipResponseIsDecompressed() {
        SiriFetcher fetcher = new SiriFetcher(url + "/gzip", 2000, 2000);

        assertEquals("<answer>compressed</answer>", fetcher.post("<request/>", List.of("1")));
    }

    @Test
    void testErrorStatusIsTransportFailure() {
        SiriFetcher fetcher = new SiriFetcher(url + "/error", 2000, 2000);

        TransportException e = assertThrows(TransportException.class, () -> fetcher.post("<request/>", List.of("1", "2")));
        assertEquals(List.of("1", "2"), e.getStopCodes());
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void testUnreachableServerIsTransportFailure() {
        server.stop(0);
        SiriFetcher fetcher = new SiriFetcher(url + "/ok", 500, 500);

        assertThrows(TransportException.class, () -> fetcher.post("<request/>", List.of("1")));
    }
}

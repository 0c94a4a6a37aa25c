package org.jouca.live_arrivals.fetchers;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.transit.realtime.GtfsRealtime.FeedHeader;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GtfsRtFetcher class.
 * 
 * Tests feed download and parsing against a local HTTP server.
 */
class GtfsRtFetcherTest {

    private HttpServer server;
    private String url;
    private final AtomicReference<String> authorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        byte[] feed = FeedMessage.newBuilder()
            .setHeader(FeedHeader.newBuilder().setGtfsRealtimeVersion("2.0").setTimestamp(1742277600L))
            .build()
            .toByteArray();

        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/feed", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.sendResponseHeaders(200, feed.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(feed);
            }
        });
        server.createContext("/garbage", exchange -> {
            byte[] body = "not a protobuf".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/forbidden", exchange -> {
            exchange.sendResponseHeaders(403, -1);
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
    void testFetchFeedSendsKeyAndParses() {
        FeedMessage feed = new GtfsRtFetcher(url + "/feed", "secret", 2000, 2000).fetchFeed();

        assertEquals(1742277600L, feed.getHeader().getTimestamp());
        assertEquals("secret", authorization.get());
    }

    @Test
    void testErrorStatusIsTransportFailure() {
        GtfsRtFetcher fetcher = new GtfsRtFetcher(url + "/forbidden", null, 2000, 2000);

        assertThrows(TransportException.class, fetcher::fetchFeed);
    }

    @Test
    void testUnparsableBodyIsSchemaFailure() {
        GtfsRtFetcher fetcher = new GtfsRtFetcher(url + "/garbage", null, 2000, 2000);

        SchemaException e = assertThrows(SchemaException.class, fetcher::fetchFeed);
        assertTrue(e.getMessage().startsWith("Delta feed body is not a feed message"));
    }
}

package org.jouca.live_arrivals.fetchers;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;

/**
 * Downloads the GTFS-RT delta feed.
 *
 * <p>The whole feed is fetched at once with the configured authorization key and parsed with the
 * protobuf bindings. Callers cache the result; this class never does.
 *
 * @author Jouca
 * @since 1.0
 */
public class GtfsRtFetcher {
    private static final Logger logger = LoggerFactory.getLogger(GtfsRtFetcher.class);

    private final String url;
    private final String authKey;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public GtfsRtFetcher(String url, String authKey, int connectTimeoutMs, int readTimeoutMs) {
        this.url = url;
        this.authKey = authKey;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Fetches and parses the current feed.
     *
     * @return the parsed feed message
     * @throws TransportException on connection error, timeout or non-2xx status
     * @throws SchemaException when the body is not a feed message
     */
    public FeedMessage fetchFeed() {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(connectTimeoutMs);
            conn.setReadTimeout(readTimeoutMs);
            conn.setRequestProperty("Accept", "application/x-protobuf");
            if (authKey != null) {
                conn.setRequestProperty("Authorization", authKey);
            }

            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                throw new TransportException("Delta feed answered HTTP " + status, List.of(), null);
            }
            byte[] body;
            try (InputStream in = conn.getInputStream()) {
                body = in.readAllBytes();
            }
            FeedMessage feed = parse(body);
            logger.debug("Fetched delta feed: {} entities, header timestamp {}",
                feed.getEntityCount(), feed.getHeader().getTimestamp());
            return feed;
        } catch (IOException e) {
            throw new TransportException("Delta feed request failed: " + e.getMessage(), e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    static FeedMessage parse(byte[] body) {
        try {
            return FeedMessage.parseFrom(body);
        } catch (InvalidProtocolBufferException e) {
            logger.error("Delta feed body is not a feed message ({} bytes): {}", body.length,
                new String(body, 0, Math.min(body.length, 512), StandardCharsets.UTF_8));
            throw new SchemaException("Delta feed body is not a feed message: " + e.getMessage(), e);
        }
    }
}

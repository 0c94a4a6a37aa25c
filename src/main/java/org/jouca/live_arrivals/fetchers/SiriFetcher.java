package org.jouca.live_arrivals.fetchers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;

import org.jouca.live_arrivals.exceptions.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport for the SIRI stop-monitoring web service.
 *
 * <p>One call posts one batched SOAP request and returns the raw response body. The fetcher:
 * <ul>
 *   <li>enforces connect and read timeouts so a hanging server fails the call</li>
 *   <li>handles GZIP-compressed responses</li>
 *   <li>turns connection errors, timeouts and non-2xx statuses into {@link TransportException}</li>
 * </ul>
 *
 * <p>Decoding is left to {@link org.jouca.live_arrivals.codecs.SiriCodec}.
 *
 * @author Jouca
 * @since 1.0
 */
public class SiriFetcher {
    private static final Logger logger = LoggerFactory.getLogger(SiriFetcher.class);

    private final String url;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    /**
     * @param url stop-monitoring service endpoint
     * @param connectTimeoutMs connection timeout in milliseconds
     * @param readTimeoutMs read timeout in milliseconds
     */
    public SiriFetcher(String url, int connectTimeoutMs, int readTimeoutMs) {
        this.url = url;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Posts a request payload and returns the response body.
     *
     * @param payload the SOAP request built by the codec
     * @param stopCodes stop codes covered by the payload, reported on failure
     * @return the raw response body
     * @throws TransportException on connection error, timeout or non-2xx status
     */
    public String post(String payload, List<String> stopCodes) {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(connectTimeoutMs);
            conn.setReadTimeout(readTimeoutMs);
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "text/xml; charset=utf-8");
            conn.setRequestProperty("Accept", "text/xml,multipart/related");
            conn.setRequestProperty("Accept-Encoding", "gzip");

            try (OutputStream out = conn.getOutputStream()) {
                out.write(payload.getBytes(StandardCharsets.UTF_8));
            }

            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                throw new TransportException("Stop-monitoring service answered HTTP " + status, stopCodes, null);
            }

            InputStream responseStream = conn.getInputStream();
            String encoding = conn.getContentEncoding();
            if (encoding != null && encoding.equalsIgnoreCase("gzip")) {
                responseStream = new GZIPInputStream(responseStream);
            }
            try (InputStream in = responseStream) {
                String body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                logger.debug("Stop-monitoring response for {} stops: {} bytes", stopCodes.size(), body.length());
                return body;
            }
        } catch (SocketTimeoutException e) {
            throw new TransportException("Stop-monitoring request timed out", stopCodes, e);
        } catch (IOException e) {
            throw new TransportException("Stop-monitoring request failed: " + e.getMessage(), stopCodes, e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }
}

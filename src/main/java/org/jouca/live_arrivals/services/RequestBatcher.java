package org.jouca.live_arrivals.services;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves visit requests for one source through a per-stop cache and bounded fetch groups.
 *
 * <p>For each request:
 * <ol>
 *   <li>stops with a live cache entry ({@code realtime:{stop_code}}) are served from the cache</li>
 *   <li>the other stops are split into groups of the source's group size</li>
 *   <li>groups are fetched concurrently, each bounded by the request timeout, and merged in
 *       group order</li>
 *   <li>the visits of every fetched stop are cached, then the cached stops are spliced in; a group
 *       whose delivery reported an error is not cached</li>
 * </ol>
 * When every stop was cached, the response timestamp is the one of the oldest cache entry used.
 *
 * <p>A group that fails with a {@link TransportException} or times out does not spoil the other
 * groups: its stops keep empty lists and an error entry is added. If nothing was fetched nor
 * cached, the first transport failure is thrown instead. Any other failure, schema errors
 * included, cancels the remaining groups and propagates.
 *
 * @author Jouca
 * @since 1.0
 */
public class RequestBatcher {
    private static final Logger logger = LoggerFactory.getLogger(RequestBatcher.class);

    private final ArrivalSource source;
    private final TtlCache<String, CacheEntry> cache;
    private final ResponseMerger merger;
    private final ExecutorService executor;
    private final Duration timeout;

    /**
     * @param source the live-data source to query
     * @param cache per-stop visit cache of this source
     * @param merger merges group responses
     * @param executor runs group fetches
     * @param timeout maximum time to wait for all groups of one request
     */
    public RequestBatcher(ArrivalSource source, TtlCache<String, CacheEntry> cache, ResponseMerger merger,
                          ExecutorService executor, Duration timeout) {
        this.source = source;
        this.cache = cache;
        this.merger = merger;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Returns the visits of {@code stopCodes}.
     *
     * @param stopCodes requested stop codes, duplicates are collapsed
     * @param maxVisits maximum number of visits per stop
     * @return a response keyed by exactly the requested stop codes
     * @throws TransportException when no group could be fetched and no stop was cached
     */
    public AggregatedResponse request(Collection<String> stopCodes, int maxVisits) {
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(stopCodes));
        Map<String, CacheEntry> fromCache = new LinkedHashMap<>();
        List<String> toFetch = new ArrayList<>();
        for (String stopCode : requested) {
            CacheEntry entry = cache.getIfPresent(cacheKey(stopCode));
            if (entry == null) {
                toFetch.add(stopCode);
            } else {
                fromCache.put(stopCode, entry);
            }
        }

        List<List<String>> groups = partition(toFetch, source.getGroupSize());
        logger.debug("[{}] {} stops cached, {} to fetch in {} groups",
            source.getProducer(), fromCache.size(), toFetch.size(), groups.size());

        List<Future<AggregatedResponse>> futures = new ArrayList<>();
        for (List<String> group : groups) {
            futures.add(executor.submit(() -> source.fetch(group, maxVisits)));
        }

        AggregatedResponse result = new AggregatedResponse(requested, null);
        List<TransportException> failures = new ArrayList<>();
        int fetched = 0;
        long deadline = System.nanoTime() + timeout.toNanos();
        for (int i = 0; i < groups.size(); i++) {
            List<String> group = groups.get(i);
            AggregatedResponse groupResponse;
            try {
                groupResponse = awaitGroup(futures.get(i), group, deadline);
            } catch (TransportException e) {
                logger.warn("[{}] Fetch failed for stops {}: {}", source.getProducer(), group, e.getMessage());
                failures.add(e);
                continue;
            } catch (RuntimeException e) {
                cancelAll(futures);
                throw e;
            }
            merger.merge(result, groupResponse);
            if (groupResponse.getErrors().isEmpty()) {
                for (String stopCode : group) {
                    cache.put(cacheKey(stopCode), new CacheEntry(result.getVisits(stopCode), groupResponse.getTimestamp()));
                }
            } else {
                // a failed delivery must not be served later as "no arrivals"
                logger.debug("[{}] Not caching stops {}: {}", source.getProducer(), group, groupResponse.getErrors());
            }
            fetched++;
        }

        OffsetDateTime oldestCached = null;
        for (Map.Entry<String, CacheEntry> entry : fromCache.entrySet()) {
            result.putVisits(entry.getKey(), entry.getValue().visits());
            OffsetDateTime cachedAt = entry.getValue().timestamp();
            if (cachedAt != null && (oldestCached == null || cachedAt.isBefore(oldestCached))) {
                oldestCached = cachedAt;
            }
        }
        if (fetched == 0) {
            result.setTimestamp(oldestCached);
        }

        if (!failures.isEmpty()) {
            if (fetched == 0 && fromCache.isEmpty()) {
                throw failures.get(0);
            }
            for (TransportException failure : failures) {
                result.addError(failureMessage(failure));
            }
        }
        return result;
    }

    private AggregatedResponse awaitGroup(Future<AggregatedResponse> future, List<String> group, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportException("Timed out after " + timeout.toMillis() + " ms", group, e);
        } catch (CancellationException e) {
            throw new TransportException("Fetch cancelled", group, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransportException("Interrupted while waiting for fetch", group, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException) {
                TransportException transport = (TransportException) cause;
                if (transport.getStopCodes().isEmpty()) {
                    throw new TransportException(transport.getMessage(), group, transport);
                }
                throw transport;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Fetch failed for stops " + group, cause);
        }
    }

    private static void cancelAll(List<Future<AggregatedResponse>> futures) {
        for (Future<AggregatedResponse> future : futures) {
            future.cancel(true);
        }
    }

    static String failureMessage(TransportException failure) {
        return "Failed to fetch realtime data for stops " + failure.getStopCodes() + ": " + failure.getMessage();
    }

    static String cacheKey(String stopCode) {
        return "realtime:" + stopCode;
    }

    static List<List<String>> partition(List<String> items, int size) {
        List<List<String>> groups = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            groups.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return groups;
    }
}

package org.jouca.live_arrivals.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TtlCache class.
 * 
 * Tests expiry, overwrite and single-flight loading with a controlled clock.
 */
class TtlCacheTest {

    private AtomicLong nanos;
    private TtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        cache = new TtlCache<>("test", Duration.ofSeconds(30), nanos::get);
    }

    @Test
    void testEntryExpiresAfterTtl() {
        cache.put("k", "v");
        advance(Duration.ofSeconds(29));
        assertEquals("v", cache.getIfPresent("k"));

        advance(Duration.ofSeconds(2));
        assertNull(cache.getIfPresent("k"));
    }

    @Test
    void testPutOverwritesAndRestartsExpiry() {
        cache.put("k", "old");
        advance(Duration.ofSeconds(20));
        cache.put("k", "new");
        advance(Duration.ofSeconds(20));

        assertEquals("new", cache.getIfPresent("k"));
    }

    @Test
    void testGetLoadsOnceWhileLive() {
        AtomicInteger loads = new AtomicInteger();

        assertEquals("v1", cache.get("k", key -> "v" + loads.incrementAndGet()));
        assertEquals("v1", cache.get("k", key -> "v" + loads.incrementAndGet()));
        assertEquals(1, loads.get());

        advance(Duration.ofSeconds(31));
        assertEquals("v2", cache.get("k", key -> "v" + loads.incrementAndGet()));
    }

    @Test
    void testNullLoaderResultIsNotCached() {
        assertNull(cache.get("k", key -> null));
        assertNull(cache.getIfPresent("k"));
    }

    @Test
    void testFailingLoaderCachesNothing() {
        assertThrows(IllegalStateException.class, () -> cache.get("k", key -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("ok", cache.get("k", key -> "ok"));
    }

    @Test
    void testConcurrentMissesShareOneLoad() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> cache.get("k", key -> {
                    loads.incrementAndGet();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "v";
                }));
            }
            Thread.sleep(100);
            release.countDown();
            for (Future<?> future : futures) {
                assertEquals("v", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void testStatsCountHitsAndMisses() {
        cache.getIfPresent("k");
        cache.get("k", key -> "v");
        cache.getIfPresent("k");
        cache.get("k", key -> "other");

        CacheStats stats = cache.stats();
        assertEquals(2, stats.hitCount());
        assertEquals(2, stats.missCount());
        assertEquals(1, stats.loadSuccessCount());
    }

    @Test
    void testInvalidTtlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<String, String>("bad", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<String, String>("bad", null));
    }

    @Test
    void testInvalidate() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.invalidate("a");
        assertNull(cache.getIfPresent("a"));
        assertEquals("2", cache.getIfPresent("b"));

        cache.invalidateAll();
        assertNull(cache.getIfPresent("b"));
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}

package org.jouca.live_arrivals.cache;

import java.time.Duration;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Time-to-live cache shared by concurrent requests.
 *
 * <p>Entries expire a fixed duration after they were written; a refresh overwrites the whole
 * value. {@link #get(Object, Function)} is single-flight: concurrent callers missing the same key
 * wait for one loader invocation instead of each running their own. Reads and writes on unrelated
 * keys never block each other.
 *
 * <p>The clock is a Caffeine {@link Ticker} so tests can drive expiry deterministically.
 * Maintenance runs on the calling thread for the same reason.
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Jouca
 * @since 1.0
 */
public class TtlCache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final Cache<K, V> cache;

    /**
     * Creates a cache driven by the system clock.
     *
     * @param name cache name used in log messages
     * @param ttl time to live of each entry, must be positive
     */
    public TtlCache(String name, Duration ttl) {
        this(name, ttl, Ticker.systemTicker());
    }

    /**
     * Creates a cache driven by {@code ticker}.
     *
     * @param name cache name used in log messages
     * @param ttl time to live of each entry, must be positive
     * @param ticker nanosecond time source
     */
    public TtlCache(String name, Duration ttl, Ticker ticker) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.name = name;
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
    }

    /**
     * Returns the live value for {@code key}, or null when absent or expired.
     */
    public V getIfPresent(K key) {
        V value = cache.getIfPresent(key);
        logger.debug("[{}] {} for {}", name, value == null ? "miss" : "hit", key);
        return value;
    }

    /**
     * Stores {@code value}, replacing any previous value and restarting its expiry clock.
     */
    public void put(K key, V value) {
        cache.put(key, value);
    }

    /**
     * Returns the value for {@code key}, computing it with {@code loader} on a miss.
     *
     * <p>Only one loader runs per key at a time. A loader returning null caches nothing; a loader
     * throwing an unchecked exception propagates it to every waiting caller and caches nothing.
     *
     * @param key the cache key
     * @param loader computes the value on a miss
     * @return the cached or freshly loaded value, or null
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        return cache.get(key, loader);
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /** Hit and miss counters since creation. */
    public CacheStats stats() {
        return cache.stats();
    }
}

package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.core.eviction.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Segmented key-value map with per-entry TTL and lock striping.
 * Keys hashing to different segments never contend for the same lock.
 */
public class SegmentedTtlMap<V> {
    private static final Logger logger = LoggerFactory.getLogger(SegmentedTtlMap.class);

    /** {@link #ttlMillis} result for a missing key. */
    public static final long NO_KEY = -2;
    /** {@link #ttlMillis} result for a key without expiry. */
    public static final long NO_EXPIRY = -1;

    private final List<TtlSegment<V>> segments;
    private final int segmentMask;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public SegmentedTtlMap(int segmentCount, int maxEntries, EvictionPolicy evictionPolicyTemplate) {
        this(segmentCount, maxEntries, evictionPolicyTemplate, Clock.systemUTC(),
                CohortDefaults.CLEANUP_INTERVAL_SECONDS);
    }

    /**
     * @param cleanupIntervalSeconds period of the background sweep of expired
     *                               entries; zero disables it
     */
    public SegmentedTtlMap(int segmentCount, int maxEntries, EvictionPolicy evictionPolicyTemplate,
            Clock clock, long cleanupIntervalSeconds) {
        int count = nextPowerOfTwo(segmentCount);
        this.segmentMask = count - 1;
        this.clock = clock;
        this.segments = new ArrayList<>(count);

        int entriesPerSegment = Math.max(1, maxEntries / count);
        for (int i = 0; i < count; i++) {
            segments.add(new TtlSegment<>(evictionPolicyTemplate.newInstance(), entriesPerSegment));
        }

        if (cleanupIntervalSeconds > 0) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cohort-ttl-cleanup");
                t.setDaemon(true);
                return t;
            });
            this.cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired,
                    cleanupIntervalSeconds, cleanupIntervalSeconds, TimeUnit.SECONDS);
        } else {
            this.cleanupExecutor = null;
        }

        logger.debug("TTL map initialized: segments={}, maxEntries={}", count, maxEntries);
    }

    public V get(String key) {
        TtlEntry<V> entry = getSegment(key).get(key, clock.millis());
        return entry != null ? entry.getValue() : null;
    }

    /**
     * @param ttlMillis lifetime; zero or negative stores without expiry
     */
    public void put(String key, V value, long ttlMillis) {
        long now = clock.millis();
        getSegment(key).put(key, new TtlEntry<>(value, now, ttlMillis));
    }

    /**
     * Stores the value only when no live entry exists.
     *
     * @return the value already present, or null if {@code value} was stored
     */
    public V putIfAbsent(String key, V value, long ttlMillis) {
        long now = clock.millis();
        TtlEntry<V> existing = getSegment(key).putIfAbsent(key, new TtlEntry<>(value, now, ttlMillis), now);
        return existing != null ? existing.getValue() : null;
    }

    public boolean delete(String key) {
        return getSegment(key).remove(key, clock.millis());
    }

    public boolean expire(String key, long ttlMillis) {
        return getSegment(key).expire(key, clock.millis(), ttlMillis);
    }

    /**
     * Remaining lifetime in milliseconds, {@link #NO_EXPIRY} for a persistent
     * key or {@link #NO_KEY} when absent.
     */
    public long ttlMillis(String key) {
        long now = clock.millis();
        TtlEntry<V> entry = getSegment(key).get(key, now);
        if (entry == null) {
            return NO_KEY;
        }
        return entry.hasExpiry() ? entry.remainingMillis(now) : NO_EXPIRY;
    }

    public void clear() {
        for (TtlSegment<V> segment : segments) {
            segment.clear();
        }
        logger.info("TTL map cleared");
    }

    public int size() {
        int total = 0;
        for (TtlSegment<V> segment : segments) {
            total += segment.size();
        }
        return total;
    }

    public List<String> keys() {
        List<String> allKeys = new ArrayList<>();
        for (TtlSegment<V> segment : segments) {
            for (String key : segment.keys()) {
                allKeys.add(key);
            }
        }
        return allKeys;
    }

    public Stats getStats() {
        long hits = 0;
        long misses = 0;
        long evictions = 0;
        for (TtlSegment<V> segment : segments) {
            hits += segment.getHitCount();
            misses += segment.getMissCount();
            evictions += segment.getEvictionCount();
        }
        return new Stats(hits, misses, evictions, size());
    }

    public int cleanupExpired() {
        long now = clock.millis();
        int cleaned = 0;
        for (TtlSegment<V> segment : segments) {
            cleaned += segment.removeExpired(now);
        }
        if (cleaned > 0) {
            logger.debug("Cleaned up {} expired entries", cleaned);
        }
        return cleaned;
    }

    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private TtlSegment<V> getSegment(String key) {
        int h = key.hashCode();
        // Spread bits to reduce collisions
        h ^= (h >>> 16);
        return segments.get(h & segmentMask);
    }

    private static int nextPowerOfTwo(int n) {
        if (n <= 0)
            return 1;
        n--;
        n |= n >>> 1;
        n |= n >>> 2;
        n |= n >>> 4;
        n |= n >>> 8;
        n |= n >>> 16;
        return n + 1;
    }

    public static class Stats {
        public final long hits;
        public final long misses;
        public final long evictions;
        public final int size;

        public Stats(long hits, long misses, long evictions, int size) {
            this.hits = hits;
            this.misses = misses;
            this.evictions = evictions;
            this.size = size;
        }

        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}

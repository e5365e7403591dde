package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.core.eviction.LRUEvictionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TTL, eviction and bookkeeping of the segmented map, driven by a manual
 * clock.
 */
class SegmentedTtlMapTest {

    private MutableClock clock;
    private SegmentedTtlMap<String> map;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        map = new SegmentedTtlMap<>(16, 10_000, new LRUEvictionPolicy(), clock, 0);
    }

    @AfterEach
    void tearDown() {
        map.shutdown();
    }

    @Test
    void testBasicPutAndGet() {
        map.put("key1", "value1", 0);
        assertEquals("value1", map.get("key1"));
        assertNull(map.get("nonexistent"));
    }

    @Test
    void testPutUpdatesExistingKey() {
        map.put("key1", "value1", 0);
        map.put("key1", "value2", 0);
        assertEquals("value2", map.get("key1"));
        assertEquals(1, map.size());
    }

    @Test
    void testDelete() {
        map.put("key1", "value1", 0);
        assertTrue(map.delete("key1"));
        assertNull(map.get("key1"));
        assertFalse(map.delete("nonexistent"));
    }

    @Test
    void testTtlExpiration() {
        map.put("key1", "value1", 1000);
        clock.advance(Duration.ofMillis(1000));
        assertEquals("value1", map.get("key1"));

        clock.advance(Duration.ofMillis(1));
        assertNull(map.get("key1"));
        assertEquals(0, map.size());
    }

    @Test
    void testDeleteOfExpiredEntryReportsAbsent() {
        map.put("key1", "value1", 10);
        clock.advance(Duration.ofSeconds(1));
        assertFalse(map.delete("key1"));
    }

    @Test
    void testTtlMillis() {
        map.put("timed", "v", 10_000);
        map.put("forever", "v", 0);
        clock.advance(Duration.ofSeconds(4));

        assertEquals(6_000, map.ttlMillis("timed"));
        assertEquals(SegmentedTtlMap.NO_EXPIRY, map.ttlMillis("forever"));
        assertEquals(SegmentedTtlMap.NO_KEY, map.ttlMillis("missing"));
    }

    @Test
    void testExpireReplacesLifetime() {
        map.put("key1", "value1", 0);
        assertTrue(map.expire("key1", 500));
        assertEquals(500, map.ttlMillis("key1"));
        assertFalse(map.expire("missing", 500));

        clock.advance(Duration.ofSeconds(1));
        assertNull(map.get("key1"));
    }

    @Test
    void testPutIfAbsentKeepsLiveValue() {
        assertNull(map.putIfAbsent("key1", "first", 1000));
        assertEquals("first", map.putIfAbsent("key1", "second", 1000));
        assertEquals("first", map.get("key1"));
    }

    @Test
    void testPutIfAbsentReplacesExpiredValue() {
        map.putIfAbsent("key1", "first", 1000);
        clock.advance(Duration.ofSeconds(2));

        assertNull(map.putIfAbsent("key1", "second", 1000));
        assertEquals("second", map.get("key1"));
    }

    @Test
    void testLruEvictionWithinSegment() {
        SegmentedTtlMap<String> small = new SegmentedTtlMap<>(1, 3, new LRUEvictionPolicy(), clock, 0);
        small.put("a", "1", 0);
        small.put("b", "2", 0);
        small.put("c", "3", 0);

        // Touch a so b becomes least recently used
        small.get("a");
        small.put("d", "4", 0);

        assertEquals(3, small.size());
        assertNull(small.get("b"));
        assertNotNull(small.get("a"));
        assertNotNull(small.get("d"));
        assertEquals(1, small.getStats().evictions);
    }

    @Test
    void testCleanupExpired() {
        for (int i = 0; i < 100; i++) {
            map.put("short-" + i, "v", 100);
            map.put("long-" + i, "v", 100_000);
        }
        clock.advance(Duration.ofSeconds(1));

        assertEquals(100, map.cleanupExpired());
        assertEquals(100, map.size());
        assertEquals(0, map.cleanupExpired());
    }

    @Test
    void testStats() {
        map.put("key1", "v", 0);
        map.get("key1");
        map.get("key1");
        map.get("missing");

        SegmentedTtlMap.Stats stats = map.getStats();
        assertEquals(2, stats.hits);
        assertEquals(1, stats.misses);
        assertEquals(2.0 / 3.0, stats.getHitRate(), 0.0001);
        assertEquals(1, stats.size);
    }

    @Test
    void testKeysAndClear() {
        map.put("a", "1", 0);
        map.put("b", "2", 0);
        assertEquals(2, map.keys().size());

        map.clear();
        assertEquals(0, map.size());
        assertTrue(map.keys().isEmpty());
    }

    @Test
    void testSegmentCountRoundedToPowerOfTwo() {
        SegmentedTtlMap<String> odd = new SegmentedTtlMap<>(10, 10_000, new LRUEvictionPolicy(), clock, 0);
        for (int i = 0; i < 500; i++) {
            odd.put("key-" + i, "v", 0);
        }
        assertEquals(500, odd.size());
    }
}

package com.krishnamouli.cohort.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Value plus expiry and access bookkeeping for eviction.
 */
public class TtlEntry<V> {
    // Logical access clock; strictly increasing so LRU order has no ties
    private static final AtomicLong ACCESS_CLOCK = new AtomicLong();

    private final V value;
    private final long expiresAtMillis;
    private volatile long lastAccessTime;

    /**
     * @param ttlMillis lifetime; zero or negative means no expiry
     */
    public TtlEntry(V value, long nowMillis, long ttlMillis) {
        this.value = value;
        this.expiresAtMillis = ttlMillis > 0 ? nowMillis + ttlMillis : Long.MAX_VALUE;
        this.lastAccessTime = ACCESS_CLOCK.incrementAndGet();
    }

    private TtlEntry(TtlEntry<V> source, long expiresAtMillis) {
        this.value = source.value;
        this.expiresAtMillis = expiresAtMillis;
        this.lastAccessTime = source.lastAccessTime;
    }

    public V getValue() {
        return value;
    }

    public void recordAccess() {
        lastAccessTime = ACCESS_CLOCK.incrementAndGet();
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis > expiresAtMillis;
    }

    public boolean hasExpiry() {
        return expiresAtMillis != Long.MAX_VALUE;
    }

    public long remainingMillis(long nowMillis) {
        return Math.max(0, expiresAtMillis - nowMillis);
    }

    /**
     * Same value with a new lifetime starting at {@code nowMillis}.
     */
    public TtlEntry<V> withTtl(long nowMillis, long ttlMillis) {
        return new TtlEntry<>(this, ttlMillis > 0 ? nowMillis + ttlMillis : Long.MAX_VALUE);
    }

    public long getLastAccessTime() {
        return lastAccessTime;
    }
}

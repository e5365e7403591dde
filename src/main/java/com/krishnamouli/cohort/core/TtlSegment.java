package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.core.eviction.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Individual segment with independent locking for concurrency.
 * Each segment manages its own subset of keys to minimize lock contention.
 */
public class TtlSegment<V> {
    private static final Logger logger = LoggerFactory.getLogger(TtlSegment.class);

    private final Map<String, TtlEntry<V>> entries;
    private final ReadWriteLock lock;
    private final EvictionPolicy evictionPolicy;
    private final int maxEntries;
    private final AtomicLong hitCount;
    private final AtomicLong missCount;
    private final AtomicLong evictionCount;

    public TtlSegment(EvictionPolicy evictionPolicy, int maxEntries) {
        this.entries = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.evictionPolicy = evictionPolicy;
        this.maxEntries = Math.max(1, maxEntries);
        this.hitCount = new AtomicLong(0);
        this.missCount = new AtomicLong(0);
        this.evictionCount = new AtomicLong(0);
    }

    public TtlEntry<V> get(String key, long nowMillis) {
        TtlEntry<V> entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
            if (entry != null && !entry.isExpired(nowMillis)) {
                entry.recordAccess();
                hitCount.incrementAndGet();
                return entry;
            }
        } finally {
            lock.readLock().unlock();
        }

        // Read lock cannot be upgraded; drop the expired entry under the write lock
        if (entry != null) {
            removeIfExpired(key, nowMillis);
        }
        missCount.incrementAndGet();
        return null;
    }

    public void put(String key, TtlEntry<V> entry) {
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(key)) {
                while (entries.size() >= maxEntries && !entries.isEmpty()) {
                    evict();
                }
            }
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Inserts the entry unless a live one exists.
     *
     * @return the live entry that won, or null if {@code entry} was inserted
     */
    public TtlEntry<V> putIfAbsent(String key, TtlEntry<V> entry, long nowMillis) {
        lock.writeLock().lock();
        try {
            TtlEntry<V> existing = entries.get(key);
            if (existing != null && !existing.isExpired(nowMillis)) {
                existing.recordAccess();
                return existing;
            }
            if (existing == null) {
                while (entries.size() >= maxEntries && !entries.isEmpty()) {
                    evict();
                }
            }
            entries.put(key, entry);
            return null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(String key, long nowMillis) {
        lock.writeLock().lock();
        try {
            TtlEntry<V> entry = entries.remove(key);
            return entry != null && !entry.isExpired(nowMillis);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the lifetime of a live entry.
     */
    public boolean expire(String key, long nowMillis, long ttlMillis) {
        lock.writeLock().lock();
        try {
            TtlEntry<V> entry = entries.get(key);
            if (entry == null || entry.isExpired(nowMillis)) {
                return false;
            }
            entries.put(key, entry.withTtl(nowMillis, ttlMillis));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int removeExpired(long nowMillis) {
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, TtlEntry<V>> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(nowMillis)) {
                expired.add(entry.getKey());
            }
        }
        int removed = 0;
        for (String key : expired) {
            if (removeIfExpired(key, nowMillis)) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    public Iterable<String> keys() {
        return entries.keySet();
    }

    private boolean removeIfExpired(String key, long nowMillis) {
        lock.writeLock().lock();
        try {
            TtlEntry<V> current = entries.get(key);
            // A concurrent put may have replaced the expired entry meanwhile
            if (current != null && current.isExpired(nowMillis)) {
                entries.remove(key);
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void evict() {
        String victimKey = evictionPolicy.selectVictim(entries);
        if (victimKey != null && entries.remove(victimKey) != null) {
            evictionCount.incrementAndGet();
            logger.debug("Evicted key: {}", victimKey);
        }
    }
}

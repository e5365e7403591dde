package com.krishnamouli.cohort.core.eviction;

import com.krishnamouli.cohort.core.TtlEntry;

import java.util.Map;

/**
 * Least Recently Used (LRU) eviction policy.
 * Evicts entries that haven't been read recently.
 */
public class LRUEvictionPolicy implements EvictionPolicy {

    @Override
    public <V> String selectVictim(Map<String, TtlEntry<V>> entries) {
        if (entries.isEmpty()) {
            return null;
        }

        String victimKey = null;
        long oldestAccess = Long.MAX_VALUE;

        for (Map.Entry<String, TtlEntry<V>> entry : entries.entrySet()) {
            long lastAccess = entry.getValue().getLastAccessTime();
            if (victimKey == null || lastAccess < oldestAccess) {
                oldestAccess = lastAccess;
                victimKey = entry.getKey();
            }
        }

        return victimKey;
    }

    @Override
    public EvictionPolicy newInstance() {
        return new LRUEvictionPolicy();
    }
}

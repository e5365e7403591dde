package com.krishnamouli.cohort.core.eviction;

import com.krishnamouli.cohort.core.TtlEntry;

import java.util.Map;

/**
 * Strategy interface for choosing which entry leaves a full segment.
 */
public interface EvictionPolicy {

    /**
     * Select an entry to evict from the segment.
     *
     * @param entries Current entries in the segment
     * @return Key of entry to evict, or null if the segment is empty
     */
    <V> String selectVictim(Map<String, TtlEntry<V>> entries);

    /**
     * Fresh policy instance for another segment.
     */
    EvictionPolicy newInstance();
}

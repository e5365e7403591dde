package com.krishnamouli.cohort.engine;

/**
 * Maps a key onto one of 100 buckets (0..99).
 */
@FunctionalInterface
public interface Bucketer {

    /**
     * @param key hash input, e.g. {@code experimentId + "-" + subjectId}
     * @return bucket in [0, 99]
     */
    int bucket(String key);
}

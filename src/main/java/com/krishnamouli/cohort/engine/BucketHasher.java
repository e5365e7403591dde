package com.krishnamouli.cohort.engine;

import com.krishnamouli.cohort.config.CohortDefaults;

/**
 * Deterministic string bucketing shared with the web client.
 *
 * <p>
 * The hash is {@code h = (h << 5) - h + c} over UTF-16 code units with 32-bit
 * wrap-around, then the absolute value. It must stay bit-for-bit identical to
 * the browser implementation so both sides place a subject in the same bucket.
 * Not a cryptographic hash.
 */
public final class BucketHasher implements Bucketer {

    public static final BucketHasher INSTANCE = new BucketHasher();

    private BucketHasher() {
    }

    /**
     * Absolute value of the 32-bit accumulator, widened to long because
     * {@code |Integer.MIN_VALUE|} does not fit in an int.
     */
    public static long hash(String input) {
        int h = 0;
        for (int i = 0; i < input.length(); i++) {
            h = (h << 5) - h + input.charAt(i);
        }
        return Math.abs((long) h);
    }

    @Override
    public int bucket(String key) {
        return (int) (hash(key) % CohortDefaults.BUCKET_COUNT);
    }
}

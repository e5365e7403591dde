package com.krishnamouli.cohort.engine;

import com.krishnamouli.cohort.experiment.Variant;

import java.util.List;

/**
 * Cumulative-allocation walk over an ordered variant list.
 */
public final class VariantSelector {

    private VariantSelector() {
    }

    /**
     * Picks the first variant whose cumulative allocation exceeds the bucket.
     * When allocations add up to less than 100 the uncovered buckets fall to
     * the last variant; when they add up to more, trailing variants may never
     * be reached.
     *
     * @return selected variant, or null when the list is empty
     */
    public static Variant select(List<Variant> variants, int bucket) {
        if (variants.isEmpty()) {
            return null;
        }

        int cumulative = 0;
        for (Variant variant : variants) {
            cumulative += variant.getAllocation();
            if (bucket < cumulative) {
                return variant;
            }
        }

        return variants.get(variants.size() - 1);
    }
}

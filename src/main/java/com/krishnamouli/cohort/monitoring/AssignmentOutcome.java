package com.krishnamouli.cohort.monitoring;

import java.util.Locale;

/**
 * How an {@code assign} call ended.
 */
public enum AssignmentOutcome {
    /** Kill switch off. */
    DISABLED,
    /** Unknown or non-active experiment. */
    NOT_FOUND,
    /** Audience targeting or rollout excluded the subject. */
    INELIGIBLE,
    /** Existing assignment returned from the store. */
    STICKY,
    /** Fresh assignment computed and persisted. */
    ASSIGNED,
    /** Fresh assignment computed but the store write failed. */
    DEGRADED,
    /** Experiment has no variants. */
    NO_VARIANTS;

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

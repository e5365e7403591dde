package com.krishnamouli.cohort.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an experiment. Only {@link #ACTIVE} experiments assign traffic.
 */
public enum ExperimentStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED;

    @JsonCreator
    public static ExperimentStatus fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

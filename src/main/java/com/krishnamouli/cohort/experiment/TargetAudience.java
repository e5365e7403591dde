package com.krishnamouli.cohort.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Audience restriction of an experiment. Empty sets place no restriction;
 * percentage limits how much of the eligible traffic enters at all.
 */
public class TargetAudience {
    private final Set<String> userTypes;
    private final Set<String> locations;
    private final int percentage;

    @JsonCreator
    public TargetAudience(
            @JsonProperty("userTypes") Set<String> userTypes,
            @JsonProperty("locations") Set<String> locations,
            @JsonProperty("percentage") Integer percentage) {
        int pct = percentage != null ? percentage : 100;
        if (pct < 0 || pct > 100) {
            throw new IllegalArgumentException("Percentage must be in [0, 100]: " + pct);
        }
        this.userTypes = copy(userTypes);
        this.locations = copy(locations);
        this.percentage = pct;
    }

    public static TargetAudience everyone() {
        return new TargetAudience(null, null, 100);
    }

    public static TargetAudience percentage(int percentage) {
        return new TargetAudience(null, null, percentage);
    }

    public Set<String> getUserTypes() {
        return userTypes;
    }

    public Set<String> getLocations() {
        return locations;
    }

    public int getPercentage() {
        return percentage;
    }

    private static Set<String> copy(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}

package com.krishnamouli.cohort.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A persisted sticky assignment. Never mutated; a new assignment replaces the
 * old one.
 */
public class Assignment {
    private final String variantId;
    private final Instant assignedAt;
    private final Instant expiresAt;

    @JsonCreator
    public Assignment(
            @JsonProperty("variantId") String variantId,
            @JsonProperty("assignedAt") Instant assignedAt,
            @JsonProperty("expiresAt") Instant expiresAt) {
        this.variantId = Objects.requireNonNull(variantId, "variantId");
        this.assignedAt = assignedAt != null ? assignedAt : Instant.now();
        this.expiresAt = expiresAt;
    }

    public static Assignment of(String variantId, Instant assignedAt, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : assignedAt.plus(ttl);
        return new Assignment(variantId, assignedAt, expiresAt);
    }

    public String getVariantId() {
        return variantId;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    /**
     * @return expiry instant, or null for an assignment that never expires
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Remaining lifetime at {@code now}; {@link Duration#ZERO} for an
     * assignment without expiry.
     */
    @JsonIgnore
    public Duration remaining(Instant now) {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return variantId.equals(that.variantId)
                && assignedAt.equals(that.assignedAt)
                && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variantId, assignedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "Assignment{" + variantId + ", assignedAt=" + assignedAt + ", expiresAt=" + expiresAt + "}";
    }
}

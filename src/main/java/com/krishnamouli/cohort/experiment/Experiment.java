package com.krishnamouli.cohort.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable experiment definition.
 *
 * <p>
 * Variant allocations are expected to add up to 100 but are not validated:
 * an under-allocated tail goes to the last variant when assigning.
 */
public class Experiment {
    private final String id;
    private final String name;
    private final String description;
    private final ExperimentStatus status;
    private final Instant startDate;
    private final Instant endDate;
    private final List<Variant> variants;
    private final TargetAudience targetAudience;
    private final List<ConversionGoal> conversionGoals;
    private final Instant createdAt;
    private final Instant updatedAt;

    @JsonCreator
    public Experiment(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("status") ExperimentStatus status,
            @JsonProperty("startDate") Instant startDate,
            @JsonProperty("endDate") Instant endDate,
            @JsonProperty("variants") List<Variant> variants,
            @JsonProperty("targetAudience") TargetAudience targetAudience,
            @JsonProperty("conversionGoals") List<ConversionGoal> conversionGoals,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("updatedAt") Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "experiment id");
        this.name = name != null ? name : id;
        this.description = description;
        this.status = status != null ? status : ExperimentStatus.DRAFT;
        this.startDate = startDate;
        this.endDate = endDate;
        this.variants = variants == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(variants));
        this.targetAudience = targetAudience;
        this.conversionGoals = conversionGoals == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(conversionGoals));
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .status(status)
                .startDate(startDate)
                .endDate(endDate)
                .variants(variants)
                .targetAudience(targetAudience)
                .conversionGoals(conversionGoals)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    /**
     * True when the experiment is active and {@code now} falls inside its
     * inclusive [startDate, endDate] window. Missing bounds are open.
     */
    public boolean isRunningAt(Instant now) {
        if (status != ExperimentStatus.ACTIVE) {
            return false;
        }
        if (startDate != null && startDate.isAfter(now)) {
            return false;
        }
        return endDate == null || !endDate.isBefore(now);
    }

    public Optional<Variant> findVariant(String variantId) {
        for (Variant variant : variants) {
            if (variant.getId().equals(variantId)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    public Optional<ConversionGoal> findGoal(String goalId) {
        for (ConversionGoal goal : conversionGoals) {
            if (goal.getId().equals(goalId)) {
                return Optional.of(goal);
            }
        }
        return Optional.empty();
    }

    public int totalAllocation() {
        int total = 0;
        for (Variant variant : variants) {
            total += variant.getAllocation();
        }
        return total;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ExperimentStatus getStatus() {
        return status;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    public TargetAudience getTargetAudience() {
        return targetAudience;
    }

    public List<ConversionGoal> getConversionGoals() {
        return conversionGoals;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return String.format("Experiment{id=%s, status=%s, variants=%s}", id, status.wireName(), variants);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private ExperimentStatus status = ExperimentStatus.ACTIVE;
        private Instant startDate;
        private Instant endDate;
        private List<Variant> variants = new ArrayList<>();
        private TargetAudience targetAudience;
        private List<ConversionGoal> conversionGoals = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(ExperimentStatus status) {
            this.status = status;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder variants(List<Variant> variants) {
            this.variants = new ArrayList<>(variants);
            return this;
        }

        public Builder variant(String variantId, int allocation) {
            this.variants.add(new Variant(variantId, allocation));
            return this;
        }

        public Builder variant(Variant variant) {
            this.variants.add(variant);
            return this;
        }

        public Builder targetAudience(TargetAudience targetAudience) {
            this.targetAudience = targetAudience;
            return this;
        }

        public Builder conversionGoals(List<ConversionGoal> conversionGoals) {
            this.conversionGoals = new ArrayList<>(conversionGoals);
            return this;
        }

        public Builder conversionGoal(ConversionGoal goal) {
            this.conversionGoals.add(goal);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Experiment build() {
            return new Experiment(id, name, description, status, startDate, endDate, variants,
                    targetAudience, conversionGoals, createdAt, updatedAt);
        }
    }
}

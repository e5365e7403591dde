package com.krishnamouli.cohort.network.http;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of {@code POST /assignment}: an assignment computed by the client that
 * the server should remember.
 */
public class AssignmentPush {
    private final String experimentId;
    private final String subjectId;
    private final String variantId;
    private final Instant assignedAt;

    @JsonCreator
    public AssignmentPush(
            @JsonProperty("experimentId") String experimentId,
            @JsonProperty("subjectId") @JsonAlias("userId") String subjectId,
            @JsonProperty("variantId") String variantId,
            @JsonProperty("assignedAt") Instant assignedAt) {
        this.experimentId = experimentId;
        this.subjectId = subjectId;
        this.variantId = variantId;
        this.assignedAt = assignedAt;
    }

    public String getExperimentId() {
        return experimentId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getVariantId() {
        return variantId;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }
}

package com.krishnamouli.cohort.network.http;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.krishnamouli.cohort.engine.AssignmentContext;

/**
 * Body of {@code POST /assign}.
 */
public class AssignRequest {
    private final String experimentId;
    private final String subjectId;
    private final AssignmentContext context;

    @JsonCreator
    public AssignRequest(
            @JsonProperty("experimentId") String experimentId,
            @JsonProperty("subjectId") @JsonAlias("userId") String subjectId,
            @JsonProperty("context") AssignmentContext context) {
        this.experimentId = experimentId;
        this.subjectId = subjectId;
        this.context = context != null ? context : AssignmentContext.empty();
    }

    public String getExperimentId() {
        return experimentId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public AssignmentContext getContext() {
        return context;
    }
}

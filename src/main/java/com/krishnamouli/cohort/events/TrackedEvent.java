package com.krishnamouli.cohort.events;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposure or conversion event reported by a client. Immutable once built.
 * Required fields are checked by {@link EventRecorder}, not here, so that a
 * malformed event can still be parsed and reported.
 */
public class TrackedEvent {
    private final String experimentId;
    private final String variantId;
    private final String subjectId;
    private final String sessionId;
    private final String event;
    private final JsonNode value;
    private final Map<String, JsonNode> metadata;
    private final Instant timestamp;

    @JsonCreator
    public TrackedEvent(
            @JsonProperty("experimentId") String experimentId,
            @JsonProperty("variantId") String variantId,
            @JsonProperty("subjectId") @JsonAlias("userId") String subjectId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("event") String event,
            @JsonProperty("value") JsonNode value,
            @JsonProperty("metadata") Map<String, JsonNode> metadata,
            @JsonProperty("timestamp") Instant timestamp) {
        this.experimentId = experimentId;
        this.variantId = variantId;
        this.subjectId = subjectId;
        this.sessionId = sessionId;
        this.event = event;
        this.value = value;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.timestamp = timestamp;
    }

    public static TrackedEvent of(String experimentId, String variantId, String subjectId,
            String sessionId, String event, Instant timestamp) {
        return new TrackedEvent(experimentId, variantId, subjectId, sessionId, event, null, null, timestamp);
    }

    public String getExperimentId() {
        return experimentId;
    }

    public String getVariantId() {
        return variantId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getEvent() {
        return event;
    }

    public JsonNode getValue() {
        return value;
    }

    public Map<String, JsonNode> getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "TrackedEvent{" + experimentId + "/" + variantId + " " + event + " session=" + sessionId
                + " at " + timestamp + "}";
    }
}

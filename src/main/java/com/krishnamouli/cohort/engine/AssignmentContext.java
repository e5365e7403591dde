package com.krishnamouli.cohort.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request attributes used for audience targeting.
 */
public class AssignmentContext {
    private static final AssignmentContext EMPTY = new AssignmentContext(null, null, null, null);

    private final String userType;
    private final String location;
    private final String rolloutKey;
    private final Map<String, JsonNode> metadata;

    @JsonCreator
    public AssignmentContext(
            @JsonProperty("userType") String userType,
            @JsonProperty("location") String location,
            @JsonProperty("rolloutKey") String rolloutKey,
            @JsonProperty("metadata") Map<String, JsonNode> metadata) {
        this.userType = userType;
        this.location = location;
        this.rolloutKey = rolloutKey;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AssignmentContext empty() {
        return EMPTY;
    }

    public static AssignmentContext ofUserType(String userType) {
        return new AssignmentContext(userType, null, null, null);
    }

    public String getUserType() {
        return userType;
    }

    public String getLocation() {
        return location;
    }

    public String getRolloutKey() {
        return rolloutKey;
    }

    public Map<String, JsonNode> getMetadata() {
        return metadata;
    }

    /**
     * Identifier the rollout percentage is hashed on: the explicit rollout
     * key, else a {@code sessionId} metadata entry, else the subject itself.
     */
    public String resolveRolloutKey(String subjectId) {
        if (rolloutKey != null && !rolloutKey.isEmpty()) {
            return rolloutKey;
        }
        JsonNode sessionId = metadata.get("sessionId");
        if (sessionId != null && sessionId.isTextual() && !sessionId.asText().isEmpty()) {
            return sessionId.asText();
        }
        return subjectId;
    }
}

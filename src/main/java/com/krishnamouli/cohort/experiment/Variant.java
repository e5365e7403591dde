package com.krishnamouli.cohort.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One treatment arm of an experiment.
 * The config payload is schema-free; callers interpret it.
 */
public class Variant {
    private final String id;
    private final String name;
    private final int allocation;
    private final Map<String, JsonNode> config;

    @JsonCreator
    public Variant(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("allocation") int allocation,
            @JsonProperty("config") Map<String, JsonNode> config) {
        if (allocation < 0 || allocation > 100) {
            throw new IllegalArgumentException("Allocation must be in [0, 100]: " + allocation);
        }
        this.id = Objects.requireNonNull(id, "variant id");
        this.name = name != null ? name : id;
        this.allocation = allocation;
        this.config = config == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public Variant(String id, int allocation) {
        this(id, id, allocation, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getAllocation() {
        return allocation;
    }

    public Map<String, JsonNode> getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return id + "(" + allocation + "%)";
    }
}

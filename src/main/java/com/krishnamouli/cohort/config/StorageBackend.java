package com.krishnamouli.cohort.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where sticky assignments live.
 */
public enum StorageBackend {
    /** Process-local TTL map, lost on restart. */
    EPHEMERAL,
    /** State carried by the caller (cookies, local storage). */
    CLIENT,
    /** Shared Redis-protocol store reached over the network. */
    REMOTE;

    @JsonCreator
    public static StorageBackend fromString(String value) {
        if (value == null) {
            return EPHEMERAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown storage backend: " + value, e);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

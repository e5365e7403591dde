package com.krishnamouli.cohort.config;

import java.util.regex.Pattern;

/**
 * Centralized defaults and limits for the experiment engine.
 */
public final class CohortDefaults {

    // Assignment
    /**
     * Number of buckets subjects are hashed into (0..99).
     */
    public static final int BUCKET_COUNT = 100;

    /**
     * Sticky assignment lifetime (30 days).
     * Matches the lifetime of the assignment cookie the web client sets.
     */
    public static final long DEFAULT_SESSION_TIMEOUT_SECONDS = 30L * 24 * 60 * 60;

    /**
     * Namespace for client-held assignment keys.
     */
    public static final String DEFAULT_COOKIE_PREFIX = "ab_test_";

    // Sticky store
    /**
     * Segments of the ephemeral store. Must be a power of two.
     */
    public static final int DEFAULT_STORE_SEGMENTS = 64;

    /**
     * Entry budget of the ephemeral store before LRU eviction kicks in.
     */
    public static final int DEFAULT_MAX_STORE_ENTRIES = 1_000_000;

    /**
     * Upper bound for one remote store round trip.
     * Past this the engine answers with an unpersisted assignment.
     */
    public static final long DEFAULT_STORE_TIMEOUT_MILLIS = 50;

    /**
     * Expired entry cleanup interval in seconds.
     */
    public static final long CLEANUP_INTERVAL_SECONDS = 60;

    // Event tracking
    /**
     * Events kept by the in-memory sink (oldest dropped first).
     */
    public static final int DEFAULT_EVENT_BUFFER_SIZE = 1000;

    /**
     * Pending writes the recorder buffers before it starts dropping events.
     */
    public static final int DEFAULT_EVENT_QUEUE_CAPACITY = 10_000;

    // Network
    /**
     * Maximum HTTP request body (1MB).
     */
    public static final int HTTP_MAX_CONTENT_LENGTH = 1024 * 1024;

    /**
     * TCP backlog of the HTTP and RESP listeners.
     */
    public static final int TCP_BACKLOG_SIZE = 128;

    // RFC 6265 token characters
    private static final Pattern COOKIE_NAME_CHARS = Pattern.compile("[A-Za-z0-9!#$%&'*+.^_`|~-]*");

    private CohortDefaults() {
        throw new AssertionError("Configuration class should not be instantiated");
    }

    /**
     * Validates a configuration on startup.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public static void validate(CohortConfig config) {
        if (config.getStorageBackend() == null) {
            throw new IllegalArgumentException("storageBackend must be set");
        }
        if (config.getSessionTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("sessionTimeoutSeconds must be positive");
        }
        if (config.getStoreTimeoutMillis() <= 0) {
            throw new IllegalArgumentException("storeTimeoutMillis must be positive");
        }
        int segments = config.getStoreSegments();
        if (segments <= 0 || (segments & (segments - 1)) != 0) {
            throw new IllegalArgumentException("storeSegments must be a power of 2");
        }
        if (config.getMaxStoreEntries() < segments) {
            throw new IllegalArgumentException("maxStoreEntries must be at least storeSegments");
        }
        if (config.getEventBufferSize() <= 0 || config.getEventQueueCapacity() <= 0) {
            throw new IllegalArgumentException("event buffer and queue sizes must be positive");
        }
        if (config.getCookiePrefix() == null || !COOKIE_NAME_CHARS.matcher(config.getCookiePrefix()).matches()) {
            throw new IllegalArgumentException("cookiePrefix must consist of cookie name characters");
        }
    }
}

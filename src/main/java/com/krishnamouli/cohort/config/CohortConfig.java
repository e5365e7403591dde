package com.krishnamouli.cohort.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Centralized configuration for the Cohort experiment engine.
 * Plain mutable bean so it can be bound from a JSON file or set up in code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CohortConfig {

    // Engine
    private boolean enabled = true;
    private StorageBackend storageBackend = StorageBackend.EPHEMERAL;
    private String cookiePrefix = CohortDefaults.DEFAULT_COOKIE_PREFIX;
    private long sessionTimeoutSeconds = CohortDefaults.DEFAULT_SESSION_TIMEOUT_SECONDS;
    private String experimentsPath;

    // Sticky store
    private int storeSegments = CohortDefaults.DEFAULT_STORE_SEGMENTS;
    private int maxStoreEntries = CohortDefaults.DEFAULT_MAX_STORE_ENTRIES;
    private String remoteHost = "localhost";
    private int remotePort = 6380;
    private long storeTimeoutMillis = CohortDefaults.DEFAULT_STORE_TIMEOUT_MILLIS;

    // Event tracking
    private String eventLogPath;
    private int eventBufferSize = CohortDefaults.DEFAULT_EVENT_BUFFER_SIZE;
    private int eventQueueCapacity = CohortDefaults.DEFAULT_EVENT_QUEUE_CAPACITY;

    // Servers
    private int httpPort = 8080;
    private int respPort = 6380;
    private boolean enableRespServer = false;
    private int workerThreads = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * Reads a configuration file; properties missing from the file keep their
     * defaults.
     */
    public static CohortConfig load(Path path) {
        try {
            return JsonMappers.newMapper().readValue(path.toFile(), CohortConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + path, e);
        }
    }

    public Duration sessionTimeout() {
        return Duration.ofSeconds(sessionTimeoutSeconds);
    }

    public Duration storeTimeout() {
        return Duration.ofMillis(storeTimeoutMillis);
    }

    // Getters and setters
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StorageBackend getStorageBackend() {
        return storageBackend;
    }

    public void setStorageBackend(StorageBackend storageBackend) {
        this.storageBackend = storageBackend;
    }

    public String getCookiePrefix() {
        return cookiePrefix;
    }

    public void setCookiePrefix(String cookiePrefix) {
        this.cookiePrefix = cookiePrefix;
    }

    public long getSessionTimeoutSeconds() {
        return sessionTimeoutSeconds;
    }

    public void setSessionTimeoutSeconds(long sessionTimeoutSeconds) {
        this.sessionTimeoutSeconds = sessionTimeoutSeconds;
    }

    public String getExperimentsPath() {
        return experimentsPath;
    }

    public void setExperimentsPath(String experimentsPath) {
        this.experimentsPath = experimentsPath;
    }

    public int getStoreSegments() {
        return storeSegments;
    }

    public void setStoreSegments(int storeSegments) {
        this.storeSegments = storeSegments;
    }

    public int getMaxStoreEntries() {
        return maxStoreEntries;
    }

    public void setMaxStoreEntries(int maxStoreEntries) {
        this.maxStoreEntries = maxStoreEntries;
    }

    public String getRemoteHost() {
        return remoteHost;
    }

    public void setRemoteHost(String remoteHost) {
        this.remoteHost = remoteHost;
    }

    public int getRemotePort() {
        return remotePort;
    }

    public void setRemotePort(int remotePort) {
        this.remotePort = remotePort;
    }

    public long getStoreTimeoutMillis() {
        return storeTimeoutMillis;
    }

    public void setStoreTimeoutMillis(long storeTimeoutMillis) {
        this.storeTimeoutMillis = storeTimeoutMillis;
    }

    public String getEventLogPath() {
        return eventLogPath;
    }

    public void setEventLogPath(String eventLogPath) {
        this.eventLogPath = eventLogPath;
    }

    public int getEventBufferSize() {
        return eventBufferSize;
    }

    public void setEventBufferSize(int eventBufferSize) {
        this.eventBufferSize = eventBufferSize;
    }

    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    public void setEventQueueCapacity(int eventQueueCapacity) {
        this.eventQueueCapacity = eventQueueCapacity;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public void setHttpPort(int httpPort) {
        this.httpPort = httpPort;
    }

    public int getRespPort() {
        return respPort;
    }

    public void setRespPort(int respPort) {
        this.respPort = respPort;
    }

    public boolean isEnableRespServer() {
        return enableRespServer;
    }

    public void setEnableRespServer(boolean enableRespServer) {
        this.enableRespServer = enableRespServer;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    @Override
    public String toString() {
        return String.format(
                "CohortConfig{enabled=%s, storage=%s, sessionTimeout=%ds, httpPort=%d, respServer=%s}",
                enabled, storageBackend.wireName(), sessionTimeoutSeconds, httpPort,
                enableRespServer ? String.valueOf(respPort) : "off");
    }
}

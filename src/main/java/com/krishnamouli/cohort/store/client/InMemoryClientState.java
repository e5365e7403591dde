package com.krishnamouli.cohort.store.client;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client state held in a map, for embedded callers that keep their own
 * per-user state object alive across requests.
 */
public class InMemoryClientState implements ClientState {
    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public String read(String name) {
        return values.get(name);
    }

    @Override
    public void write(String name, String value, Duration maxAge) {
        values.put(name, value);
    }

    @Override
    public void delete(String name) {
        values.remove(name);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(values);
    }
}

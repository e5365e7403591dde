package com.krishnamouli.cohort.store.client;

import java.time.Duration;

/**
 * Named string values that travel with the caller between requests, such as
 * browser cookies or local storage.
 */
public interface ClientState {

    /**
     * @return stored value, or null
     */
    String read(String name);

    /**
     * @param maxAge how long the client should keep the value
     */
    void write(String name, String value, Duration maxAge);

    void delete(String name);
}

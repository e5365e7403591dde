package com.krishnamouli.cohort.events;

import java.io.IOException;
import java.util.List;

/**
 * Append-only destination for tracked events. Called from a single writer
 * thread; reads may come from any thread.
 */
public interface EventSink {

    void append(TrackedEvent event) throws IOException;

    /**
     * @return events recorded for the experiment, oldest first
     */
    List<TrackedEvent> findByExperiment(String experimentId) throws IOException;

    default void close() throws IOException {
    }
}

package com.krishnamouli.cohort.events;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent events in memory, discarding the oldest once full.
 */
public class InMemoryEventSink implements EventSink {
    private final int capacity;
    private final Deque<TrackedEvent> events;

    public InMemoryEventSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public synchronized void append(TrackedEvent event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    @Override
    public synchronized List<TrackedEvent> findByExperiment(String experimentId) {
        List<TrackedEvent> matching = new ArrayList<>();
        for (TrackedEvent event : events) {
            if (event.getExperimentId().equals(experimentId)) {
                matching.add(event);
            }
        }
        return matching;
    }

    public synchronized int size() {
        return events.size();
    }
}

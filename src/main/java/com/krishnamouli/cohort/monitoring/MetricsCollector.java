package com.krishnamouli.cohort.monitoring;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assignment and tracking metrics.
 * Uses HdrHistogram for accurate latency tracking.
 */
public class MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // 1 hour max in microseconds, 3 significant digits
    private static final long HIGHEST_TRACKABLE_MICROS = 3_600_000_000L;

    private final Histogram assignLatency;
    private final Map<AssignmentOutcome, AtomicLong> outcomes;
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicLong eventsAccepted = new AtomicLong();
    private final AtomicLong eventsRejected = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong eventsWritten = new AtomicLong();

    public MetricsCollector() {
        this.assignLatency = new ConcurrentHistogram(HIGHEST_TRACKABLE_MICROS, 3);
        this.outcomes = new EnumMap<>(AssignmentOutcome.class);
        for (AssignmentOutcome outcome : AssignmentOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    public void recordAssignment(AssignmentOutcome outcome, long latencyNanos) {
        outcomes.get(outcome).incrementAndGet();
        try {
            assignLatency.recordValue(latencyNanos / 1000); // Convert to microseconds
        } catch (ArrayIndexOutOfBoundsException e) {
            logger.warn("Latency value out of bounds: {}ns", latencyNanos);
        }
    }

    public void recordStoreFailure() {
        storeFailures.incrementAndGet();
    }

    public void recordEventAccepted() {
        eventsAccepted.incrementAndGet();
    }

    public void recordEventRejected() {
        eventsRejected.incrementAndGet();
    }

    public void recordEventDropped() {
        eventsDropped.incrementAndGet();
    }

    public void recordEventWritten() {
        eventsWritten.incrementAndGet();
    }

    public long getOutcomeCount(AssignmentOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    public long getStoreFailures() {
        return storeFailures.get();
    }

    public MetricsSnapshot getSnapshot() {
        Map<AssignmentOutcome, Long> counts = new EnumMap<>(AssignmentOutcome.class);
        long total = 0;
        for (Map.Entry<AssignmentOutcome, AtomicLong> entry : outcomes.entrySet()) {
            long count = entry.getValue().get();
            counts.put(entry.getKey(), count);
            total += count;
        }

        return new MetricsSnapshot(
                total,
                counts,
                storeFailures.get(),
                eventsAccepted.get(),
                eventsRejected.get(),
                eventsDropped.get(),
                eventsWritten.get(),
                assignLatency.getValueAtPercentile(50.0) / 1000.0, // P50 in ms
                assignLatency.getValueAtPercentile(95.0) / 1000.0, // P95 in ms
                assignLatency.getValueAtPercentile(99.0) / 1000.0); // P99 in ms
    }

    public void reset() {
        assignLatency.reset();
        outcomes.values().forEach(counter -> counter.set(0));
        storeFailures.set(0);
        eventsAccepted.set(0);
        eventsRejected.set(0);
        eventsDropped.set(0);
        eventsWritten.set(0);
    }

    public static class MetricsSnapshot {
        public final long totalAssignments;
        public final Map<AssignmentOutcome, Long> outcomes;
        public final long storeFailures;
        public final long eventsAccepted;
        public final long eventsRejected;
        public final long eventsDropped;
        public final long eventsWritten;
        public final double p50LatencyMs;
        public final double p95LatencyMs;
        public final double p99LatencyMs;

        public MetricsSnapshot(
                long totalAssignments, Map<AssignmentOutcome, Long> outcomes, long storeFailures,
                long eventsAccepted, long eventsRejected, long eventsDropped, long eventsWritten,
                double p50LatencyMs, double p95LatencyMs, double p99LatencyMs) {

            this.totalAssignments = totalAssignments;
            this.outcomes = outcomes;
            this.storeFailures = storeFailures;
            this.eventsAccepted = eventsAccepted;
            this.eventsRejected = eventsRejected;
            this.eventsDropped = eventsDropped;
            this.eventsWritten = eventsWritten;
            this.p50LatencyMs = p50LatencyMs;
            this.p95LatencyMs = p95LatencyMs;
            this.p99LatencyMs = p99LatencyMs;
        }
    }
}

package com.krishnamouli.cohort.events;

import com.krishnamouli.cohort.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Records exposure and conversion events off the request path.
 *
 * <p>
 * {@link #trackEvent} validates synchronously and hands the event to a single
 * background writer through a bounded queue. Tracking is best effort: a full
 * queue or a failing sink drops the event with a warning and the caller never
 * sees the failure.
 */
public class EventRecorder {
    private static final Logger logger = LoggerFactory.getLogger(EventRecorder.class);

    private static final Duration SHUTDOWN_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final EventSink sink;
    private final MetricsCollector metrics;
    private final BlockingQueue<TrackedEvent> eventQueue;
    private final ExecutorService writer;
    private final Object drainLock = new Object();
    private long pending; // guarded by drainLock
    private boolean accepting = true; // guarded by drainLock

    public EventRecorder(EventSink sink, int queueCapacity, MetricsCollector metrics) {
        this.sink = sink;
        this.metrics = metrics;
        this.eventQueue = new LinkedBlockingQueue<>(queueCapacity);

        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-writer");
            t.setDaemon(true);
            return t;
        });
        writer.submit(this::processQueue);
    }

    /**
     * @throws EventValidationException if a required field is missing or blank
     */
    public void trackEvent(TrackedEvent event) {
        try {
            validate(event);
        } catch (EventValidationException e) {
            metrics.recordEventRejected();
            throw e;
        }

        // Checked under the lock so nothing is enqueued after shutdown starts draining
        synchronized (drainLock) {
            if (!accepting) {
                metrics.recordEventDropped();
                logger.warn("Event recorder is shut down, dropping {}", event);
                return;
            }
            if (!eventQueue.offer(event)) {
                metrics.recordEventDropped();
                logger.warn("Event queue full ({} pending), dropping {}", pending, event);
                return;
            }
            pending++;
            metrics.recordEventAccepted();
        }
    }

    /**
     * Raw events recorded for the experiment. Events still queued are not
     * included; call {@link #flush} first for read-your-writes.
     */
    public List<TrackedEvent> getResults(String experimentId) {
        try {
            return sink.findByExperiment(experimentId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read events for " + experimentId, e);
        }
    }

    /**
     * Waits until every accepted event has been handed to the sink.
     *
     * @return true if the queue drained within the timeout
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainLock) {
            while (pending > 0) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                drainLock.wait(remainingMillis);
            }
        }
        return true;
    }

    /**
     * Stops accepting events, drains what is queued and closes the sink.
     */
    public void shutdown() {
        synchronized (drainLock) {
            accepting = false;
        }
        try {
            if (!flush(SHUTDOWN_DRAIN_TIMEOUT)) {
                logger.warn("Event queue not drained within {}, {} events lost", SHUTDOWN_DRAIN_TIMEOUT,
                        eventQueue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        writer.shutdownNow();
        try {
            writer.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            sink.close();
        } catch (IOException e) {
            logger.warn("Failed to close event sink", e);
        }
    }

    public int queuedEvents() {
        return eventQueue.size();
    }

    private void processQueue() {
        while (!Thread.currentThread().isInterrupted()) {
            TrackedEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                sink.append(event);
                metrics.recordEventWritten();
            } catch (IOException | RuntimeException e) {
                metrics.recordEventDropped();
                logger.warn("Failed to record {}: {}", event, e.toString());
            } finally {
                synchronized (drainLock) {
                    pending--;
                    drainLock.notifyAll();
                }
            }
        }
    }

    private static void validate(TrackedEvent event) {
        if (event == null) {
            throw new EventValidationException("event");
        }
        requireText(event.getExperimentId(), "experimentId");
        requireText(event.getVariantId(), "variantId");
        requireText(event.getSessionId(), "sessionId");
        requireText(event.getEvent(), "event");
        if (event.getTimestamp() == null) {
            throw new EventValidationException("timestamp");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new EventValidationException(field);
        }
    }
}

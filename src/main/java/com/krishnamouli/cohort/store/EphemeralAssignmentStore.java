package com.krishnamouli.cohort.store;

import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.core.SegmentedTtlMap;
import com.krishnamouli.cohort.core.eviction.LRUEvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local sticky store. Data is lost on restart; used on a single node
 * or as the last-resort fallback when nothing shared is available.
 *
 * <p>
 * Capacity is bounded by {@code maxEntries}. Once a segment is full the least
 * recently used assignment is evicted before its expiry, so that subject is
 * assigned afresh on its next request and may land in another variant when
 * allocations have changed. Evictions are reported by {@link #evictedCount()}
 * and exported as {@code cohort_store_evictions_total}; size the store so the
 * counter stays at zero.
 */
public class EphemeralAssignmentStore implements AssignmentStore {
    private static final Logger logger = LoggerFactory.getLogger(EphemeralAssignmentStore.class);

    private final SegmentedTtlMap<Assignment> assignments;
    private final Clock clock;

    public EphemeralAssignmentStore(int segmentCount, int maxEntries) {
        this(segmentCount, maxEntries, Clock.systemUTC(), CohortDefaults.CLEANUP_INTERVAL_SECONDS);
    }

    public EphemeralAssignmentStore(int segmentCount, int maxEntries, Clock clock, long cleanupIntervalSeconds) {
        this.clock = clock;
        this.assignments = new SegmentedTtlMap<>(segmentCount, maxEntries, new LRUEvictionPolicy(),
                clock, cleanupIntervalSeconds);
        logger.info("Ephemeral assignment store ready: segments={}, maxEntries={}", segmentCount, maxEntries);
    }

    @Override
    public Optional<Assignment> get(String experimentId, String subjectId) {
        Assignment assignment = assignments.get(key(experimentId, subjectId));
        if (assignment == null || assignment.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(assignment);
    }

    @Override
    public void put(String experimentId, String subjectId, Assignment assignment) {
        Instant now = clock.instant();
        if (assignment.isExpired(now)) {
            remove(experimentId, subjectId);
            return;
        }
        assignments.put(key(experimentId, subjectId), assignment, ttlMillis(assignment, now));
    }

    /**
     * Atomic per key: the first live assignment wins.
     */
    @Override
    public void set(String experimentId, String subjectId, String variantId, Duration ttl) {
        Instant now = clock.instant();
        Assignment candidate = Assignment.of(variantId, now, ttl);
        String key = key(experimentId, subjectId);
        Assignment existing = assignments.putIfAbsent(key, candidate, ttlMillis(candidate, now));
        if (existing != null && !existing.getVariantId().equals(variantId)) {
            logger.debug("Kept existing assignment {} for {} over {}", existing.getVariantId(), key, variantId);
        }
    }

    @Override
    public boolean remove(String experimentId, String subjectId) {
        return assignments.delete(key(experimentId, subjectId));
    }

    public int size() {
        return assignments.size();
    }

    @Override
    public long evictedCount() {
        return assignments.getStats().evictions;
    }

    public SegmentedTtlMap.Stats getStats() {
        return assignments.getStats();
    }

    @Override
    public void close() {
        assignments.shutdown();
    }

    private static long ttlMillis(Assignment assignment, Instant now) {
        if (assignment.getExpiresAt() == null) {
            return 0;
        }
        return Math.max(1, assignment.remaining(now).toMillis());
    }

    // Length prefix keeps ("a_b", "c") and ("a", "b_c") apart
    private static String key(String experimentId, String subjectId) {
        return experimentId.length() + ":" + experimentId + ":" + subjectId;
    }
}

package com.krishnamouli.cohort.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Strategy interface for sticky assignment persistence.
 *
 * <p>
 * Contract shared by every backend:
 * <ul>
 * <li>an expired record is indistinguishable from a missing one;</li>
 * <li>a record is gone after expiry, explicit removal, or eviction by a
 * capacity-bounded backend ({@link #evictedCount});</li>
 * <li>{@link #set} never replaces a live record, so repeating it is a no-op
 * and racing writers converge on the first value;</li>
 * <li>operations on different keys never wait on each other.</li>
 * </ul>
 * Implementations report I/O trouble with {@link StoreUnavailableException}.
 */
public interface AssignmentStore {

    /**
     * @return live assignment for the key, or empty if absent or expired
     */
    Optional<Assignment> get(String experimentId, String subjectId);

    /**
     * Stores an assignment computed by the caller, keeping its
     * {@code assignedAt}.
     */
    void put(String experimentId, String subjectId, Assignment assignment);

    /**
     * Removes the record so the next request assigns afresh.
     *
     * @return true if a live record was removed
     */
    boolean remove(String experimentId, String subjectId);

    /**
     * Stores {@code variantId} for {@code ttl} unless a live record exists.
     * Use {@link #put} to overwrite.
     */
    default void set(String experimentId, String subjectId, String variantId, Duration ttl) {
        if (get(experimentId, subjectId).isPresent()) {
            return;
        }
        put(experimentId, subjectId, Assignment.of(variantId, Instant.now(), ttl));
    }

    /**
     * Live records this backend dropped to stay within capacity. Each one is a
     * subject that will be re-assigned on its next request.
     *
     * @return eviction count, 0 for backends that never evict
     */
    default long evictedCount() {
        return 0;
    }

    /**
     * Releases connections or background threads. Idempotent.
     */
    default void close() {
    }

    /**
     * Key layout shared by the string-keyed backends.
     */
    static String key(String prefix, String experimentId, String subjectId) {
        return prefix + experimentId + "_" + subjectId;
    }
}

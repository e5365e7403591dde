package com.krishnamouli.cohort.store.client;

import com.krishnamouli.cohort.store.Assignment;
import com.krishnamouli.cohort.store.AssignmentCodec;
import com.krishnamouli.cohort.store.AssignmentStore;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Sticky store living with the caller. Each assignment is one entry named
 * {@code cookiePrefix + experimentId + "_" + subjectId} holding URL-encoded
 * JSON. Both ids are URL-encoded inside the name so that any id, such as an
 * email address, yields a valid cookie name; ids made of letters, digits and
 * {@code . - _ *} keep their plain form.
 */
public class ClientStateAssignmentStore implements AssignmentStore {
    private final ClientState state;
    private final String prefix;
    private final Clock clock;

    public ClientStateAssignmentStore(ClientState state, String cookiePrefix) {
        this(state, cookiePrefix, Clock.systemUTC());
    }

    public ClientStateAssignmentStore(ClientState state, String cookiePrefix, Clock clock) {
        this.state = state;
        this.prefix = cookiePrefix;
        this.clock = clock;
    }

    @Override
    public Optional<Assignment> get(String experimentId, String subjectId) {
        String name = entryName(experimentId, subjectId);
        String raw = state.read(name);
        if (raw == null) {
            return Optional.empty();
        }

        Optional<Assignment> assignment;
        try {
            assignment = AssignmentCodec.decode(URLDecoder.decode(raw, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            // Malformed percent-encoding, tampered or truncated by the client
            assignment = Optional.empty();
        }
        if (assignment.isEmpty() || assignment.get().isExpired(clock.instant())) {
            state.delete(name);
            return Optional.empty();
        }
        return assignment;
    }

    @Override
    public void put(String experimentId, String subjectId, Assignment assignment) {
        String name = entryName(experimentId, subjectId);
        Instant now = clock.instant();
        if (assignment.isExpired(now)) {
            state.delete(name);
            return;
        }
        String encoded = URLEncoder.encode(AssignmentCodec.encode(assignment), StandardCharsets.UTF_8);
        Duration maxAge = assignment.getExpiresAt() != null
                ? assignment.remaining(now)
                : Duration.ofDays(365);
        state.write(name, encoded, maxAge);
    }

    @Override
    public void set(String experimentId, String subjectId, String variantId, Duration ttl) {
        if (get(experimentId, subjectId).isPresent()) {
            return;
        }
        put(experimentId, subjectId, Assignment.of(variantId, clock.instant(), ttl));
    }

    @Override
    public boolean remove(String experimentId, String subjectId) {
        boolean present = get(experimentId, subjectId).isPresent();
        state.delete(entryName(experimentId, subjectId));
        return present;
    }

    String entryName(String experimentId, String subjectId) {
        return AssignmentStore.key(prefix, encodeId(experimentId), encodeId(subjectId));
    }

    private static String encodeId(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}

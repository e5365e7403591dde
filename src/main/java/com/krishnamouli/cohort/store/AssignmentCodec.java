package com.krishnamouli.cohort.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.config.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON form of a stored assignment:
 * {@code {"variantId":..,"assignedAt":..,"expiresAt":..}}.
 * Shared by the client-held and remote backends so both read each other's
 * records.
 */
public final class AssignmentCodec {
    private static final Logger logger = LoggerFactory.getLogger(AssignmentCodec.class);
    private static final ObjectMapper MAPPER = JsonMappers.newMapper();

    private AssignmentCodec() {
    }

    public static String encode(Assignment assignment) {
        try {
            return MAPPER.writeValueAsString(assignment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Assignment is not serializable: " + assignment, e);
        }
    }

    /**
     * @return decoded assignment, or empty for a corrupt document (treated as
     *         absent so the subject is simply re-assigned)
     */
    public static Optional<Assignment> decode(String json) {
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(json, Assignment.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable assignment record: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}

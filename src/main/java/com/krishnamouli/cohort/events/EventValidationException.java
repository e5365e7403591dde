package com.krishnamouli.cohort.events;

/**
 * A tracked event is missing a required field. Thrown before anything is
 * written.
 */
public class EventValidationException extends RuntimeException {
    private final String field;

    public EventValidationException(String field) {
        super("Missing required event field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

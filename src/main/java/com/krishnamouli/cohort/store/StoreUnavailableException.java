package com.krishnamouli.cohort.store;

/**
 * Raised by an {@link AssignmentStore} that cannot answer in time: connection
 * refused, timeout, or an error reply from the backing server.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

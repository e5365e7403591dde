package com.krishnamouli.cohort.network.http;

/**
 * Request body or path is unusable; answered with 400.
 */
class BadRequestException extends RuntimeException {

    BadRequestException(String message) {
        super(message);
    }
}

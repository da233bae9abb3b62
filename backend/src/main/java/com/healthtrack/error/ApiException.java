package com.healthtrack.error;

import org.springframework.http.HttpStatus;

/**
 * Base of every error that maps to a deliberate, user-visible HTTP response.
 * Anything that is not an {@code ApiException} is reported as an internal error.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

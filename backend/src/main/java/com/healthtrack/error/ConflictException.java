package com.healthtrack.error;

import org.springframework.http.HttpStatus;

/** Uniqueness violation, e.g. an email that is already registered. */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}

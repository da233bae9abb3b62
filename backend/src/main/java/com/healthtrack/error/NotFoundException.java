package com.healthtrack.error;

import org.springframework.http.HttpStatus;

/**
 * Missing entity, or an entity owned by someone else. The two are reported
 * identically so callers cannot probe for other users' ids.
 */
public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}

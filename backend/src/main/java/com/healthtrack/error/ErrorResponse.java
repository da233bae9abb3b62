package com.healthtrack.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthtrack.validation.FieldError;

import java.util.List;

/**
 * JSON error body. {@code errors} is only present for validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<FieldError> errors) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, null);
    }
}

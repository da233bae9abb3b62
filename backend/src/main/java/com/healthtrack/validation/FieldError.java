package com.healthtrack.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One rejected input field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldError(String field, String message, Object value) {
}

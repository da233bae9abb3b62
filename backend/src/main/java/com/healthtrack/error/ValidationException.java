package com.healthtrack.error;

import com.healthtrack.validation.FieldError;
import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends ApiException {

    public static final String MESSAGE = "Validation failed";

    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super(HttpStatus.BAD_REQUEST, MESSAGE);
        this.errors = List.copyOf(errors);
    }

    public static ValidationException of(String field, String message, Object value) {
        return new ValidationException(List.of(new FieldError(field, message, value)));
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}

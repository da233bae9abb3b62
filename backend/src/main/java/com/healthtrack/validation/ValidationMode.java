package com.healthtrack.validation;

public enum ValidationMode {
    /** Required fields must be present. */
    CREATE,
    /** Every field is optional; present fields must still be valid. */
    PATCH,
    /** Like PATCH, and blank values count as absent (query strings). */
    QUERY
}

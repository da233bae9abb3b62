package com.healthtrack.security;

/**
 * Why a request could not be tied to a usable identity. All but
 * {@link #FORBIDDEN} are reported as 401; clients can only tell them apart
 * by the message.
 */
public enum AuthFailure {
    MISSING("Access denied. No token provided."),
    INVALID("Access denied. Invalid token."),
    EXPIRED("Access denied. Token expired."),
    INACTIVE_USER("Access denied. Invalid token or user inactive."),
    FORBIDDEN("Access denied. Admin privileges required.");

    private final String message;

    AuthFailure(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}

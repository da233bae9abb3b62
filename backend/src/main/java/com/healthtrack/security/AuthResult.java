package com.healthtrack.security;

/**
 * Outcome of resolving a bearer credential: exactly one of {@code user} and
 * {@code failure} is set.
 */
public record AuthResult(AuthenticatedUser user, AuthFailure failure) {

    public static AuthResult success(AuthenticatedUser user) {
        return new AuthResult(user, null);
    }

    public static AuthResult failure(AuthFailure failure) {
        return new AuthResult(null, failure);
    }

    public boolean isAuthenticated() {
        return user != null;
    }
}

package com.healthtrack.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtrack.model.User;
import com.healthtrack.model.UserPreferences;

import java.time.Instant;
import java.util.Map;

/**
 * A user's own profile. Never carries the password hash.
 */
public record UserView(
        Long id,
        String name,
        String email,
        Map<String, Object> preferences,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("isAdmin") boolean isAdmin,
        Instant lastLogin,
        Instant createdAt,
        Instant updatedAt
) {

    public static UserView from(User user) {
        return new UserView(
                user.getId(),
                user.getName(),
                user.getEmail(),
                UserPreferences.withDefaults(user.getPreferences()),
                user.isActive(),
                user.isAdmin(),
                user.getLastLogin(),
                user.getCreatedAt(),
                user.getUpdatedAt());
    }
}

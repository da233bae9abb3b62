package com.healthtrack.controller.dto;

import com.healthtrack.model.User;

/**
 * The owner as embedded in alerts and tests: id, name and email only.
 */
public record UserSummary(Long id, String name, String email) {

    public static UserSummary from(User user) {
        return new UserSummary(user.getId(), user.getName(), user.getEmail());
    }
}

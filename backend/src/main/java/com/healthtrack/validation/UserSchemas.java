package com.healthtrack.validation;

import com.healthtrack.model.Language;
import com.healthtrack.model.NotificationThreshold;
import com.healthtrack.model.Theme;
import com.healthtrack.model.UserPreferences;

public final class UserSchemas {

    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String PASSWORD = "password";
    public static final String CURRENT_PASSWORD = "currentPassword";
    public static final String NEW_PASSWORD = "newPassword";
    public static final String CONFIRM_PASSWORD = "confirmPassword";
    public static final String IS_ACTIVE = "isActive";

    private static final String NAME_MESSAGE = "Name must be between 2 and 100 characters";

    public static final Schema REGISTER = Schema.of(
            FieldRule.string(NAME).required().bounds(2, 100).message(NAME_MESSAGE),
            FieldRule.email(EMAIL).required(),
            FieldRule.string(PASSWORD).required().untrimmed().secret().bounds(6, 128)
                    .message("Password must be at least 6 characters long")
    );

    public static final Schema LOGIN = Schema.of(
            FieldRule.email(EMAIL).required(),
            FieldRule.string(PASSWORD).required().untrimmed().secret().bounds(1, null)
                    .message("Password is required")
    );

    public static final Schema PROFILE = Schema.of(
            FieldRule.string(NAME).bounds(2, 100).message(NAME_MESSAGE),
            FieldRule.email(EMAIL)
    );

    public static final Schema PREFERENCES = Schema.of(
            FieldRule.oneOf(UserPreferences.NOTIFICATION_THRESHOLD, NotificationThreshold.class)
                    .message("Notification threshold must be low, medium, or high"),
            FieldRule.bool(UserPreferences.EMAIL_NOTIFICATIONS)
                    .message("Email notifications must be a boolean"),
            FieldRule.oneOf(UserPreferences.THEME, Theme.class)
                    .message("Theme must be light or dark"),
            FieldRule.oneOf(UserPreferences.LANGUAGE, Language.class)
                    .message("Language must be en, es, fr, or de")
    );

    public static final Schema PASSWORD_CHANGE = Schema.of(
            FieldRule.string(CURRENT_PASSWORD).required().untrimmed().secret().bounds(1, null)
                    .message("Current password is required"),
            FieldRule.string(NEW_PASSWORD).required().untrimmed().secret().bounds(6, 128)
                    .message("New password must be at least 6 characters long"),
            FieldRule.string(CONFIRM_PASSWORD).required().untrimmed().secret()
                    .message("Password confirmation does not match")
    );

    public static final Schema ACTIVATION = Schema.of(
            FieldRule.bool(IS_ACTIVE).required().message("isActive must be a boolean")
    );

    private UserSchemas() {
    }
}

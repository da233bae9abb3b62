package com.healthtrack.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recognized preference keys and their defaults. A user's stored map only
 * holds what they changed; {@link #withDefaults(Map)} fills in the rest.
 */
public final class UserPreferences {

    public static final String NOTIFICATION_THRESHOLD = "notificationThreshold";
    public static final String EMAIL_NOTIFICATIONS = "emailNotifications";
    public static final String THEME = "theme";
    public static final String LANGUAGE = "language";

    private UserPreferences() {
    }

    public static Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(NOTIFICATION_THRESHOLD, NotificationThreshold.MEDIUM.wireValue());
        defaults.put(EMAIL_NOTIFICATIONS, Boolean.TRUE);
        defaults.put(THEME, Theme.LIGHT.wireValue());
        defaults.put(LANGUAGE, Language.EN.wireValue());
        return defaults;
    }

    public static Map<String, Object> withDefaults(Map<String, Object> stored) {
        Map<String, Object> merged = defaults();
        if (stored != null) {
            merged.putAll(stored);
        }
        return merged;
    }
}

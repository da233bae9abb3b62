package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lowest alert priority a user wants to be notified about. */
public enum NotificationThreshold implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireValue;

    NotificationThreshold(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}

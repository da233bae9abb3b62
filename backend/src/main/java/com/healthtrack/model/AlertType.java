package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** What an alert is about. */
public enum AlertType implements WireEnum {
    GENERAL("general"),
    HEALTH("health"),
    SYSTEM("system"),
    DIAGNOSTIC("diagnostic"),
    REMINDER("reminder");

    private final String wireValue;

    AlertType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @jakarta.persistence.Converter
    public static class JpaConverter extends WireEnumConverter<AlertType> {
        public JpaConverter() {
            super(AlertType.class);
        }
    }
}

package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle state of an alert. */
public enum AlertStatus implements WireEnum {
    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String wireValue;

    AlertStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @jakarta.persistence.Converter
    public static class JpaConverter extends WireEnumConverter<AlertStatus> {
        public JpaConverter() {
            super(AlertStatus.class);
        }
    }
}

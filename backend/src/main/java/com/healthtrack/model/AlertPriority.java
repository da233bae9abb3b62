package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an alert. {@link #rank()} orders severities so that
 * critical sorts above high, high above medium, and so on.
 */
public enum AlertPriority implements WireEnum {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String wireValue;
    private final int rank;

    AlertPriority(String wireValue, int rank) {
        this.wireValue = wireValue;
        this.rank = rank;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public int rank() {
        return rank;
    }

    @jakarta.persistence.Converter
    public static class JpaConverter extends WireEnumConverter<AlertPriority> {
        public JpaConverter() {
            super(AlertPriority.class);
        }
    }
}

package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle state of a diagnostic test. */
public enum TestStatus implements WireEnum {
    PENDING("pending"),
    COMPLETED("completed"),
    REVIEWED("reviewed"),
    CANCELLED("cancelled");

    private final String wireValue;

    TestStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @jakarta.persistence.Converter
    public static class JpaConverter extends WireEnumConverter<TestStatus> {
        public JpaConverter() {
            super(TestStatus.class);
        }
    }
}

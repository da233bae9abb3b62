package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of a diagnostic test. */
public enum TestType implements WireEnum {
    BLOOD("blood"),
    URINE("urine"),
    IMAGING("imaging"),
    CARDIAC("cardiac"),
    NEUROLOGICAL("neurological"),
    GENETIC("genetic"),
    GENERAL("general");

    private final String wireValue;

    TestType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @jakarta.persistence.Converter
    public static class JpaConverter extends WireEnumConverter<TestType> {
        public JpaConverter() {
            super(TestType.class);
        }
    }
}

package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Theme implements WireEnum {
    LIGHT("light"),
    DARK("dark");

    private final String wireValue;

    Theme(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}

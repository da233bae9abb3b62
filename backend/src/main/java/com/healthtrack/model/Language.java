package com.healthtrack.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Language implements WireEnum {
    EN("en"),
    ES("es"),
    FR("fr"),
    DE("de");

    private final String wireValue;

    Language(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}

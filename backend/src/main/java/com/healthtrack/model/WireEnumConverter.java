package com.healthtrack.model;

import jakarta.persistence.AttributeConverter;

/**
 * Stores a {@link WireEnum} column as its wire value, so the database and the
 * JSON API share one spelling.
 */
public abstract class WireEnumConverter<E extends Enum<E> & WireEnum> implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected WireEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.wireValue();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return WireEnum.fromWire(type, dbData)
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown " + type.getSimpleName() + " value in database: " + dbData));
    }
}

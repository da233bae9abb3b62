package com.healthtrack.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An enumeration whose values travel over the wire and into the database
 * as a lowercase token ("active", "critical", ...).
 */
public interface WireEnum {

    String wireValue();

    static <E extends Enum<E> & WireEnum> Optional<E> fromWire(Class<E> type, String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.wireValue().equals(value)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    static <E extends Enum<E> & WireEnum> List<String> wireValues(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(WireEnum::wireValue)
                .toList();
    }
}

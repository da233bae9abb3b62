package com.healthtrack.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input that passed a {@link Schema}: only declared fields, each converted to
 * its Java type (trimmed strings, enum constants, {@code LocalDate}s, ...).
 * A key that is present with a {@code null} value was explicitly cleared.
 */
public final class ValidatedInput {

    private final Map<String, Object> values;

    ValidatedInput(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public <T> T get(String field, Class<T> type) {
        return type.cast(values.get(field));
    }

    public <T> T getOrDefault(String field, Class<T> type, T fallback) {
        return has(field) ? get(field, type) : fallback;
    }

    /** An object field, or {@code null} when absent or cleared. */
    public Map<String, Object> object(String field) {
        if (!(values.get(field) instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    /** An array field, or {@code null} when absent or cleared. */
    public List<Object> array(String field) {
        return values.get(field) instanceof List<?> list ? new ArrayList<>(list) : null;
    }

    /** Present fields in schema order. */
    public Map<String, Object> asMap() {
        return values;
    }
}

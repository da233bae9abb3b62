package com.healthtrack.validation;

import com.healthtrack.error.ValidationException;
import com.healthtrack.model.WireEnum;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates a {@link Schema} against raw request input (a JSON body or a map of
 * query parameters). Every rule is checked so the caller gets the complete
 * list of field errors in one response.
 */
public final class SchemaValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private SchemaValidator() {
    }

    /**
     * @throws ValidationException if any field is rejected
     */
    public static ValidatedInput validate(Schema schema, Map<String, ?> input, ValidationMode mode) {
        Map<String, ?> source = input == null ? Map.of() : input;
        Map<String, Object> accepted = new LinkedHashMap<>();
        List<FieldError> errors = new ArrayList<>();

        for (FieldRule rule : schema.rules()) {
            String field = rule.name();
            boolean present = source.containsKey(field);
            Object raw = source.get(field);

            if (present && mode == ValidationMode.QUERY && raw instanceof String s && s.isBlank()) {
                present = false;
            }
            if (!present) {
                if (rule.isRequired() && mode == ValidationMode.CREATE) {
                    errors.add(reject(rule, null));
                }
                continue;
            }
            if (raw == null) {
                if (rule.isNullable()) {
                    accepted.put(field, null);
                } else {
                    errors.add(reject(rule, null));
                }
                continue;
            }

            Object converted = convert(rule, raw);
            if (converted == null) {
                errors.add(reject(rule, raw));
            } else {
                accepted.put(field, converted);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new ValidatedInput(accepted);
    }

    /** Returns the converted value, or null when the value breaks the rule. */
    private static Object convert(FieldRule rule, Object raw) {
        return switch (rule.kind()) {
            case STRING -> convertString(rule, raw);
            case EMAIL -> convertEmail(raw);
            case INTEGER -> convertInteger(rule, raw);
            case BOOLEAN -> convertBoolean(raw);
            case DATE -> convertDate(raw);
            case ENUM -> convertEnum(rule, raw);
            case OBJECT -> raw instanceof Map<?, ?> map ? copyObject(map) : null;
            case ARRAY -> raw instanceof List<?> list ? new ArrayList<Object>(list) : null;
        };
    }

    private static String convertString(FieldRule rule, Object raw) {
        if (!(raw instanceof String s)) {
            return null;
        }
        String value = rule.isTrim() ? s.trim() : s;
        if (rule.min() != null && value.length() < rule.min()) {
            return null;
        }
        if (rule.max() != null && value.length() > rule.max()) {
            return null;
        }
        return value;
    }

    private static String convertEmail(Object raw) {
        if (!(raw instanceof String s)) {
            return null;
        }
        String value = s.trim().toLowerCase(Locale.ROOT);
        if (value.length() > 255 || !EMAIL.matcher(value).matches()) {
            return null;
        }
        return value;
    }

    private static Integer convertInteger(FieldRule rule, Object raw) {
        Integer value = null;
        if (raw instanceof Integer i) {
            value = i;
        } else if (raw instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            value = l.intValue();
        } else if (raw instanceof String s) {
            try {
                value = Integer.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value == null) {
            return null;
        }
        if (rule.min() != null && value < rule.min()) {
            return null;
        }
        if (rule.max() != null && value > rule.max()) {
            return null;
        }
        return value;
    }

    private static Boolean convertBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            String value = s.trim();
            if ("true".equals(value)) {
                return Boolean.TRUE;
            }
            if ("false".equals(value)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * Accepts an ISO date, or an ISO date-time of which only the date is kept.
     */
    private static LocalDate convertDate(Object raw) {
        if (!(raw instanceof String s)) {
            return null;
        }
        String value = s.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException notPlainDate) {
            try {
                return OffsetDateTime.parse(value).toLocalDate();
            } catch (DateTimeParseException notOffset) {
                try {
                    return LocalDateTime.parse(value).toLocalDate();
                } catch (DateTimeParseException notLocal) {
                    return null;
                }
            }
        }
    }

    private static Object convertEnum(FieldRule rule, Object raw) {
        if (!(raw instanceof String s)) {
            return null;
        }
        for (Enum<?> constant : rule.enumType().getEnumConstants()) {
            if (((WireEnum) constant).wireValue().equals(s)) {
                return constant;
            }
        }
        return null;
    }

    private static Map<String, Object> copyObject(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static FieldError reject(FieldRule rule, Object value) {
        return new FieldError(rule.name(), rule.message(), rule.isSecret() ? null : value);
    }
}

package com.healthtrack.validation;

import com.healthtrack.model.WireEnum;

import java.util.List;

/**
 * Constraints for a single input field. Built fluently and collected into a
 * {@link Schema}:
 *
 * <pre>
 * FieldRule.string("title").required().bounds(1, 255)
 *         .message("Title must be between 1 and 255 characters")
 * </pre>
 *
 * Strings are trimmed before checking unless {@link #untrimmed()} is set.
 */
public final class FieldRule {

    public enum Kind {
        STRING, EMAIL, INTEGER, BOOLEAN, DATE, ENUM, OBJECT, ARRAY
    }

    private final String name;
    private final Kind kind;
    private final Class<? extends Enum<?>> enumType;
    private final List<String> enumValues;

    private boolean required;
    private boolean nullable;
    private boolean trim = true;
    private boolean secret;
    private Integer min;
    private Integer max;
    private String message;

    private FieldRule(String name, Kind kind, Class<? extends Enum<?>> enumType, List<String> enumValues) {
        this.name = name;
        this.kind = kind;
        this.enumType = enumType;
        this.enumValues = enumValues;
    }

    public static FieldRule string(String name) {
        return new FieldRule(name, Kind.STRING, null, List.of());
    }

    public static FieldRule email(String name) {
        return new FieldRule(name, Kind.EMAIL, null, List.of());
    }

    public static FieldRule integer(String name) {
        return new FieldRule(name, Kind.INTEGER, null, List.of());
    }

    public static FieldRule bool(String name) {
        return new FieldRule(name, Kind.BOOLEAN, null, List.of());
    }

    public static FieldRule date(String name) {
        return new FieldRule(name, Kind.DATE, null, List.of());
    }

    public static FieldRule object(String name) {
        return new FieldRule(name, Kind.OBJECT, null, List.of());
    }

    public static FieldRule array(String name) {
        return new FieldRule(name, Kind.ARRAY, null, List.of());
    }

    public static <E extends Enum<E> & WireEnum> FieldRule oneOf(String name, Class<E> type) {
        return new FieldRule(name, Kind.ENUM, type, WireEnum.wireValues(type));
    }

    public FieldRule required() {
        this.required = true;
        return this;
    }

    /** Explicit {@code null} is accepted and means "clear this field". */
    public FieldRule nullable() {
        this.nullable = true;
        return this;
    }

    public FieldRule untrimmed() {
        this.trim = false;
        return this;
    }

    /** The rejected value is never echoed back in an error. */
    public FieldRule secret() {
        this.secret = true;
        return this;
    }

    /**
     * Inclusive bounds, read by kind: character count for strings, value for
     * integers. Either side may be null.
     */
    public FieldRule bounds(Integer min, Integer max) {
        this.min = min;
        this.max = max;
        return this;
    }

    public FieldRule message(String message) {
        this.message = message;
        return this;
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public Class<? extends Enum<?>> enumType() {
        return enumType;
    }

    public List<String> enumValues() {
        return enumValues;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isTrim() {
        return trim;
    }

    public boolean isSecret() {
        return secret;
    }

    public Integer min() {
        return min;
    }

    public Integer max() {
        return max;
    }

    public String message() {
        if (message != null) {
            return message;
        }
        return switch (kind) {
            case STRING -> describeLength();
            case EMAIL -> "Please provide a valid email";
            case INTEGER -> describeRange();
            case BOOLEAN -> name + " must be a boolean";
            case DATE -> name + " must be a valid date";
            case ENUM -> name + " must be one of " + String.join(", ", enumValues);
            case OBJECT -> name + " must be an object";
            case ARRAY -> name + " must be an array";
        };
    }

    private String describeLength() {
        if (min != null && max != null) {
            return name + " must be between " + min + " and " + max + " characters";
        }
        if (max != null) {
            return name + " must not exceed " + max + " characters";
        }
        if (min != null && min == 1) {
            return name + " is required";
        }
        if (min != null) {
            return name + " must be at least " + min + " characters long";
        }
        return name + " must be a string";
    }

    private String describeRange() {
        if (min != null && max != null) {
            return name + " must be between " + min + " and " + max;
        }
        if (min != null) {
            return name + " must be an integer of at least " + min;
        }
        return name + " must be an integer";
    }
}

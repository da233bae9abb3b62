package com.healthtrack.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of field rules describing one kind of request input.
 */
public final class Schema {

    private final List<FieldRule> rules;

    private Schema(List<FieldRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public static Schema of(FieldRule... rules) {
        return new Schema(new ArrayList<>(List.of(rules)));
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * Shorthand for {@link SchemaValidator#validate(Schema, Map, ValidationMode)}.
     */
    public ValidatedInput validate(Map<String, ?> input, ValidationMode mode) {
        return SchemaValidator.validate(this, input, mode);
    }
}

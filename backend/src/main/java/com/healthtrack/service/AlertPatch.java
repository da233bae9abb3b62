package com.healthtrack.service;

import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertPriority;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.model.AlertType;
import com.healthtrack.validation.AlertSchemas;
import com.healthtrack.validation.ValidatedInput;

import java.util.Map;

/**
 * Changes to an alert. Only fields present in the request are touched;
 * metadata is merged into the existing map, everything else is replaced.
 */
public final class AlertPatch {

    private final ValidatedInput input;

    private AlertPatch(ValidatedInput input) {
        this.input = input;
    }

    public static AlertPatch of(ValidatedInput input) {
        return new AlertPatch(input);
    }

    public void applyTo(Alert alert, AlertTransitions transitions) {
        for (Map.Entry<String, Object> field : input.asMap().entrySet()) {
            Object value = field.getValue();
            switch (field.getKey()) {
                case AlertSchemas.TITLE -> alert.setTitle((String) value);
                case AlertSchemas.MESSAGE -> alert.setMessage((String) value);
                case AlertSchemas.STATUS -> transitions.moveTo(alert, (AlertStatus) value);
                case AlertSchemas.PRIORITY -> alert.setPriority((AlertPriority) value);
                case AlertSchemas.TYPE -> alert.setType((AlertType) value);
                case AlertSchemas.METADATA -> alert.mergeMetadata(input.object(AlertSchemas.METADATA));
                default -> throw new IllegalStateException("Unhandled alert field: " + field.getKey());
            }
        }
    }
}

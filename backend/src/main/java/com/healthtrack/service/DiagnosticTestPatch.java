package com.healthtrack.service;

import com.healthtrack.model.DiagnosticTest;
import com.healthtrack.model.TestStatus;
import com.healthtrack.model.TestType;
import com.healthtrack.validation.DiagnosticTestSchemas;
import com.healthtrack.validation.ValidatedInput;

import java.time.LocalDate;
import java.util.Map;

/**
 * Changes to a diagnostic test. Present fields replace the stored value,
 * attachments included; an explicit null clears an optional text field.
 */
public final class DiagnosticTestPatch {

    private final ValidatedInput input;

    private DiagnosticTestPatch(ValidatedInput input) {
        this.input = input;
    }

    public static DiagnosticTestPatch of(ValidatedInput input) {
        return new DiagnosticTestPatch(input);
    }

    public void applyTo(DiagnosticTest test, DiagnosticTestTransitions transitions) {
        for (Map.Entry<String, Object> field : input.asMap().entrySet()) {
            Object value = field.getValue();
            switch (field.getKey()) {
                case DiagnosticTestSchemas.NAME -> test.setName((String) value);
                case DiagnosticTestSchemas.RESULT -> test.setResult((String) value);
                case DiagnosticTestSchemas.DATE -> test.setDate((LocalDate) value);
                case DiagnosticTestSchemas.TEST_TYPE -> test.setTestType((TestType) value);
                case DiagnosticTestSchemas.STATUS -> transitions.moveTo(test, (TestStatus) value);
                case DiagnosticTestSchemas.NORMAL_RANGE -> test.setNormalRange((String) value);
                case DiagnosticTestSchemas.UNITS -> test.setUnits((String) value);
                case DiagnosticTestSchemas.NOTES -> test.setNotes((String) value);
                case DiagnosticTestSchemas.DOCTOR_NAME -> test.setDoctorName((String) value);
                case DiagnosticTestSchemas.LAB_NAME -> test.setLabName((String) value);
                case DiagnosticTestSchemas.IS_ABNORMAL -> test.setAbnormal((Boolean) value);
                case DiagnosticTestSchemas.ATTACHMENTS -> test.setAttachments(input.array(DiagnosticTestSchemas.ATTACHMENTS));
                default -> throw new IllegalStateException("Unhandled diagnostic test field: " + field.getKey());
            }
        }
    }
}

package com.healthtrack.validation;

import com.healthtrack.model.TestStatus;
import com.healthtrack.model.TestType;

public final class DiagnosticTestSchemas {

    public static final String NAME = "name";
    public static final String RESULT = "result";
    public static final String DATE = "date";
    public static final String TEST_TYPE = "testType";
    public static final String STATUS = "status";
    public static final String NORMAL_RANGE = "normalRange";
    public static final String UNITS = "units";
    public static final String NOTES = "notes";
    public static final String DOCTOR_NAME = "doctorName";
    public static final String LAB_NAME = "labName";
    public static final String IS_ABNORMAL = "isAbnormal";
    public static final String ATTACHMENTS = "attachments";

    public static final String DATE_FROM = "dateFrom";
    public static final String DATE_TO = "dateTo";
    public static final String DAYS = "days";

    public static final int DEFAULT_RECENT_DAYS = 30;

    public static final Schema CREATE = body(true);

    public static final Schema UPDATE = body(false);

    public static final Schema LIST = Schema.of(
            QuerySchemas.page(),
            QuerySchemas.limit(),
            FieldRule.oneOf(TEST_TYPE, TestType.class).message("Invalid test type filter"),
            FieldRule.oneOf(STATUS, TestStatus.class).message("Invalid status filter"),
            FieldRule.bool(IS_ABNORMAL).message("isAbnormal must be a boolean"),
            FieldRule.date(DATE_FROM).message("dateFrom must be a valid date"),
            FieldRule.date(DATE_TO).message("dateTo must be a valid date")
    );

    public static final Schema RECENT = Schema.of(
            FieldRule.integer(DAYS).bounds(1, 3650).message("Days must be between 1 and 3650")
    );

    private DiagnosticTestSchemas() {
    }

    private static Schema body(boolean create) {
        FieldRule name = FieldRule.string(NAME).bounds(1, 255).message("Name must be between 1 and 255 characters");
        FieldRule result = FieldRule.string(RESULT).bounds(1, null).message("Result is required");
        FieldRule date = FieldRule.date(DATE).message("Date must be a valid date");
        if (create) {
            name.required();
            result.required();
            date.required();
        }
        return Schema.of(
                name,
                result,
                date,
                FieldRule.oneOf(TEST_TYPE, TestType.class)
                        .message("Test type must be blood, urine, imaging, cardiac, neurological, genetic, or general"),
                FieldRule.oneOf(STATUS, TestStatus.class)
                        .message("Status must be pending, completed, reviewed, or cancelled"),
                FieldRule.string(NORMAL_RANGE).nullable().bounds(null, 255)
                        .message("Normal range must not exceed 255 characters"),
                FieldRule.string(UNITS).nullable().bounds(null, 50)
                        .message("Units must not exceed 50 characters"),
                FieldRule.string(NOTES).nullable().bounds(null, 1000)
                        .message("Notes must not exceed 1000 characters"),
                FieldRule.string(DOCTOR_NAME).nullable().bounds(null, 255)
                        .message("Doctor name must not exceed 255 characters"),
                FieldRule.string(LAB_NAME).nullable().bounds(null, 255)
                        .message("Lab name must not exceed 255 characters"),
                FieldRule.bool(IS_ABNORMAL).message("isAbnormal must be a boolean"),
                FieldRule.array(ATTACHMENTS).message("Attachments must be an array")
        );
    }
}

package com.healthtrack.validation;

import com.healthtrack.model.AlertPriority;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.model.AlertType;

public final class AlertSchemas {

    public static final String TITLE = "title";
    public static final String MESSAGE = "message";
    public static final String STATUS = "status";
    public static final String PRIORITY = "priority";
    public static final String TYPE = "type";
    public static final String METADATA = "metadata";

    private static final String TITLE_MESSAGE = "Title must be between 1 and 255 characters";
    private static final String MESSAGE_MESSAGE = "Message must not exceed 1000 characters";
    private static final String STATUS_MESSAGE = "Status must be active, acknowledged, resolved, or dismissed";
    private static final String PRIORITY_MESSAGE = "Priority must be low, medium, high, or critical";
    private static final String TYPE_MESSAGE = "Type must be general, health, system, diagnostic, or reminder";

    public static final Schema CREATE = Schema.of(
            FieldRule.string(TITLE).required().bounds(1, 255).message(TITLE_MESSAGE),
            FieldRule.string(MESSAGE).nullable().bounds(null, 1000).message(MESSAGE_MESSAGE),
            FieldRule.oneOf(PRIORITY, AlertPriority.class).message(PRIORITY_MESSAGE),
            FieldRule.oneOf(TYPE, AlertType.class).message(TYPE_MESSAGE),
            FieldRule.object(METADATA).message("Metadata must be an object")
    );

    public static final Schema UPDATE = Schema.of(
            FieldRule.string(TITLE).bounds(1, 255).message(TITLE_MESSAGE),
            FieldRule.string(MESSAGE).nullable().bounds(null, 1000).message(MESSAGE_MESSAGE),
            FieldRule.oneOf(STATUS, AlertStatus.class).message(STATUS_MESSAGE),
            FieldRule.oneOf(PRIORITY, AlertPriority.class).message(PRIORITY_MESSAGE),
            FieldRule.oneOf(TYPE, AlertType.class).message(TYPE_MESSAGE),
            FieldRule.object(METADATA).message("Metadata must be an object")
    );

    public static final Schema LIST = Schema.of(
            QuerySchemas.page(),
            QuerySchemas.limit(),
            FieldRule.oneOf(STATUS, AlertStatus.class).message("Invalid status filter"),
            FieldRule.oneOf(PRIORITY, AlertPriority.class).message("Invalid priority filter"),
            FieldRule.oneOf(TYPE, AlertType.class).message("Invalid type filter")
    );

    private AlertSchemas() {
    }
}

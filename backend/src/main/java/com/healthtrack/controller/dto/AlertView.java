package com.healthtrack.controller.dto;

import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertPriority;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.model.AlertType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record AlertView(
        Long id,
        String title,
        String message,
        AlertStatus status,
        AlertPriority priority,
        AlertType type,
        Long userId,
        Map<String, Object> metadata,
        Instant acknowledgedAt,
        Instant resolvedAt,
        Instant createdAt,
        Instant updatedAt,
        UserSummary user
) {

    public static AlertView from(Alert alert) {
        return new AlertView(
                alert.getId(),
                alert.getTitle(),
                alert.getMessage(),
                alert.getStatus(),
                alert.getPriority(),
                alert.getType(),
                alert.getUser().getId(),
                alert.getMetadata() == null ? new LinkedHashMap<>() : alert.getMetadata(),
                alert.getAcknowledgedAt(),
                alert.getResolvedAt(),
                alert.getCreatedAt(),
                alert.getUpdatedAt(),
                UserSummary.from(alert.getUser()));
    }
}

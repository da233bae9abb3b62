package com.healthtrack.service;

import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Status changes on alerts and their timestamp side effects. Both the
 * dedicated endpoints and the generic update go through {@link #moveTo}, so
 * acknowledgedAt / resolvedAt are set once, on first entry, whichever path
 * is used.
 */
@Component
public class AlertTransitions {

    private final Clock clock;

    public AlertTransitions(Clock clock) {
        this.clock = clock;
    }

    public void acknowledge(Alert alert) {
        moveTo(alert, AlertStatus.ACKNOWLEDGED);
    }

    public void resolve(Alert alert) {
        moveTo(alert, AlertStatus.RESOLVED);
    }

    public void dismiss(Alert alert) {
        moveTo(alert, AlertStatus.DISMISSED);
    }

    public void moveTo(Alert alert, AlertStatus target) {
        alert.setStatus(target);
        if (target == AlertStatus.ACKNOWLEDGED && alert.getAcknowledgedAt() == null) {
            alert.setAcknowledgedAt(now());
        }
        if (target == AlertStatus.RESOLVED && alert.getResolvedAt() == null) {
            alert.setResolvedAt(now());
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}

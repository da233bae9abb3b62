package com.healthtrack.service;

import java.time.Instant;

public record UserStats(
        long totalAlerts,
        long activeAlerts,
        long totalTests,
        Instant memberSince,
        Instant lastLogin
) {
}

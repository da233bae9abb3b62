package com.healthtrack.query;

import java.util.Map;

/**
 * Alert counts for one user. Grouped maps are sparse: a status or priority
 * with no alerts has no key.
 */
public record AlertSummary(long total, Map<String, Long> byStatus, Map<String, Long> byPriority) {
}

package com.healthtrack.query;

import java.util.Map;

/**
 * Diagnostic test counts for one user. {@code recent} covers the last
 * {@link #RECENT_DAYS} days; grouped maps are sparse.
 */
public record DiagnosticTestSummary(
        long total,
        long abnormal,
        long recent,
        Map<String, Long> byStatus,
        Map<String, Long> byType
) {

    public static final int RECENT_DAYS = 30;
}

package com.civiclens.common;

/**
 * Snapshot of outbound request accounting from {@link RateLimitMonitor}.
 */
public record RateLimitStats(
        long totalRequests,
        int requestsLastMinute,
        int requestsLastHour,
        double averageRequestsPerSecond,
        long estimatedHourlyRate,
        WarningLevel warningLevel
) {
}

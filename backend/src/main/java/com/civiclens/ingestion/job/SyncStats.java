package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;

import java.util.Map;

/**
 * Aggregates over sync_runs started within a lookback window.
 *
 * @param successRate COMPLETED runs over all runs; 0 when there are none
 */
public record SyncStats(int recentSyncs, double successRate, long avgDurationMs, Map<ResourceType, ResourceStats> byResource) {

    public record ResourceStats(int syncs, int errors) {
    }
}

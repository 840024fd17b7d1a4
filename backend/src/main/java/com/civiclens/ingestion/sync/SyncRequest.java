package com.civiclens.ingestion.sync;

import com.civiclens.domain.SyncStrategy;

import java.time.Duration;
import java.time.Instant;

/**
 * Strategy-specific parameters for one resource sync.
 *
 * @param runId     owning SyncRun; null for ad-hoc calls that are not audited
 * @param congress  congress filter; null means all
 * @param fromDate  lower bound on upstream updateDate (WINDOW)
 * @param toDate    upper bound on upstream updateDate (WINDOW)
 * @param limit     max records processed
 * @param staleAfter staleness threshold (STALE)
 */
public record SyncRequest(
        String runId,
        SyncStrategy strategy,
        FetchMode mode,
        Integer congress,
        Instant fromDate,
        Instant toDate,
        int limit,
        Duration staleAfter
) {

    public SyncRequest {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}

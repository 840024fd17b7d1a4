package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.sync.SyncResult;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one orchestrator invocation.
 *
 * @param results        per resource actually attempted, in processing order
 * @param success        no resource failed or was rejected
 * @param failedResource first resource whose run failed; null when none did
 */
public record OrchestratorResult(
        SyncStrategy strategy,
        List<ResourceType> resources,
        Map<ResourceType, SyncResult> results,
        Duration totalDuration,
        SyncTotals totals,
        int totalErrors,
        boolean success,
        ResourceType failedResource
) {

    public OrchestratorResult {
        results = results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(results)) : Map.of();
    }

    public SyncResult resultFor(ResourceType resourceType) {
        return results.get(resourceType);
    }
}

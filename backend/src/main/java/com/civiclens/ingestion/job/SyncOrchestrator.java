package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncRun;
import com.civiclens.ingestion.sync.ResourceSyncService;
import com.civiclens.ingestion.sync.SyncRequest;
import com.civiclens.ingestion.sync.SyncResult;
import com.civiclens.ingestion.sync.progress.SyncAlreadyRunningException;
import com.civiclens.ingestion.sync.progress.SyncRunTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the sync routines of the requested resources one after another, each under its own sync_runs row.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final Map<ResourceType, ResourceSyncService> services = new EnumMap<>(ResourceType.class);
    private final SyncPlanner syncPlanner;
    private final SyncRunTracker syncRunTracker;
    private final Clock clock;

    public SyncOrchestrator(List<ResourceSyncService> syncServices, SyncPlanner syncPlanner,
                            SyncRunTracker syncRunTracker, Clock clock) {
        for (ResourceSyncService service : syncServices) {
            ResourceSyncService previous = services.put(service.resourceType(), service);
            if (previous != null) {
                throw new IllegalStateException("Two sync routines for " + service.resourceType());
            }
        }
        this.syncPlanner = syncPlanner;
        this.syncRunTracker = syncRunTracker;
        this.clock = clock;
    }

    public OrchestratorResult sync(SyncOptions options) {
        long startedNanos = System.nanoTime();
        log.info("Starting {} sync for {}", options.strategy(), options.resources());
        Map<ResourceType, SyncResult> results = new LinkedHashMap<>();
        boolean success = true;
        ResourceType failedResource = null;

        for (ResourceType resource : options.resources()) {
            ResourceSyncService service = services.get(resource);
            if (service == null) {
                log.warn("No sync routine for {}; skipping", resource);
                results.put(resource, SyncResult.failed(resource.name(), "No sync routine for " + resource));
                success = false;
                continue;
            }
            SyncRun run;
            try {
                run = syncRunTracker.open(resource, options.strategy());
            } catch (SyncAlreadyRunningException e) {
                log.warn("Skipping {}: {}", resource, e.getMessage());
                results.put(resource, SyncResult.failed(resource.name(), e.getMessage()));
                success = false;
                continue;
            }
            try {
                SyncRequest request = syncPlanner.plan(options.strategy(), resource, run.getId());
                SyncResult result = service.sync(request);
                syncRunTracker.complete(run, result);
                results.put(resource, result);
            } catch (RuntimeException e) {
                log.error("{} sync run {} failed: {}", resource, run.getId(), e.getMessage(), e);
                markFailed(run, e);
                results.put(resource, SyncResult.failed(resource.name(), e.getMessage()));
                success = false;
                if (failedResource == null) {
                    failedResource = resource;
                }
                if (!options.continueOnFailure()) {
                    break;
                }
            }
        }

        SyncTotals totals = SyncTotals.of(results.values());
        int totalErrors = results.values().stream().mapToInt(r -> r.errors().size()).sum();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedNanos);
        log.info("{} sync finished in {} ms: success={} fetched={} created={} updated={} unchanged={} changes={} errors={}",
                options.strategy(), elapsed.toMillis(), success, totals.fetched(), totals.created(), totals.updated(),
                totals.unchanged(), totals.changes(), totalErrors);
        return new OrchestratorResult(options.strategy(), options.resources(), results, elapsed, totals, totalErrors,
                success, failedResource);
    }

    private void markFailed(SyncRun run, RuntimeException cause) {
        try {
            syncRunTracker.fail(run, cause);
        } catch (RuntimeException e) {
            log.error("Could not mark {} sync run {} as FAILED; it stays RUNNING until stale recovery: {}",
                    run.getResourceType(), run.getId(), e.getMessage(), e);
        }
    }

    /**
     * Stats over runs started in the last {@code hours} hours.
     */
    public SyncStats getSyncStats(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(Math.max(0, hours)));
        List<SyncRun> runs = syncRunTracker.runsStartedSince(since);
        if (runs.isEmpty()) {
            return new SyncStats(0, 0.0, 0L, Map.of());
        }
        long completed = runs.stream().filter(r -> r.getStatus() == SyncRun.SyncRunStatus.COMPLETED).count();
        long avgDurationMs = Math.round(runs.stream()
                .filter(r -> r.getDurationMs() != null)
                .mapToLong(SyncRun::getDurationMs)
                .average()
                .orElse(0.0));
        Map<ResourceType, int[]> counts = new EnumMap<>(ResourceType.class);
        for (SyncRun run : runs) {
            int[] c = counts.computeIfAbsent(run.getResourceType(), k -> new int[2]);
            c[0]++;
            c[1] += run.getErrorsEncountered() != null ? run.getErrorsEncountered().size() : 0;
        }
        Map<ResourceType, SyncStats.ResourceStats> byResource = new EnumMap<>(ResourceType.class);
        counts.forEach((type, c) -> byResource.put(type, new SyncStats.ResourceStats(c[0], c[1])));
        return new SyncStats(runs.size(), (double) completed / runs.size(), avgDurationMs, byResource);
    }
}

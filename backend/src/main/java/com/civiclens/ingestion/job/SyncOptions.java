package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncStrategy;

import java.util.List;

/**
 * What one orchestrator invocation syncs.
 *
 * @param resources         processed in list order
 * @param continueOnFailure keep going with the next resource after a run-level failure
 */
public record SyncOptions(SyncStrategy strategy, List<ResourceType> resources, boolean continueOnFailure) {

    public static final List<ResourceType> DEFAULT_RESOURCES =
            List.of(ResourceType.BILLS, ResourceType.MEMBERS, ResourceType.HEARINGS);

    public SyncOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        resources = resources == null || resources.isEmpty() ? DEFAULT_RESOURCES : List.copyOf(resources);
    }

    public static SyncOptions incremental() {
        return of(SyncStrategy.INCREMENTAL);
    }

    public static SyncOptions of(SyncStrategy strategy) {
        return new SyncOptions(strategy, DEFAULT_RESOURCES, false);
    }

    public SyncOptions withResources(List<ResourceType> value) {
        return new SyncOptions(strategy, value, continueOnFailure);
    }

    public SyncOptions continuingOnFailure() {
        return new SyncOptions(strategy, resources, true);
    }
}

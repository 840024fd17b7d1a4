package com.civiclens.ingestion.sync.progress;

import com.civiclens.domain.ResourceType;

/**
 * Thrown when a sync is requested for a resource that already has a live RUNNING run.
 */
public class SyncAlreadyRunningException extends RuntimeException {

    private final ResourceType resourceType;

    public SyncAlreadyRunningException(ResourceType resourceType, String runningRunId) {
        super("Sync already running for " + resourceType + (runningRunId != null ? " (run " + runningRunId + ")" : ""));
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }
}

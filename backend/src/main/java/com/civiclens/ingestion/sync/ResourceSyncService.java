package com.civiclens.ingestion.sync;

import com.civiclens.domain.ResourceType;

/**
 * Incremental fetch-and-reconcile routine for one upstream resource.
 * Record-level failures end up in {@link SyncResult#errors()}; anything thrown is a run-level failure.
 */
public interface ResourceSyncService {

    ResourceType resourceType();

    SyncResult sync(SyncRequest request);
}

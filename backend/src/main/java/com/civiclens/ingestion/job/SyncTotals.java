package com.civiclens.ingestion.job;

import com.civiclens.ingestion.sync.SyncResult;

import java.util.Collection;

/**
 * Counts summed over every resource of an orchestrator run.
 */
public record SyncTotals(int fetched, int created, int updated, int unchanged, int changes) {

    public static SyncTotals of(Collection<SyncResult> results) {
        int fetched = 0;
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int changes = 0;
        for (SyncResult r : results) {
            fetched += r.recordsFetched();
            created += r.recordsCreated();
            updated += r.recordsUpdated();
            unchanged += r.recordsUnchanged();
            changes += r.changesDetected();
        }
        return new SyncTotals(fetched, created, updated, unchanged, changes);
    }
}

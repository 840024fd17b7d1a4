package com.civiclens.ingestion.sync;

import com.civiclens.domain.SyncError;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable counters for a sync routine in progress. Owned by one routine; not thread-safe.
 */
public class SyncTally {

    private final long startedNanos = System.nanoTime();
    private final long apiRequestsAtStart;
    private int fetched;
    private int created;
    private int updated;
    private int unchanged;
    private int changes;
    private final List<SyncError> errors = new ArrayList<>();
    private Instant cursor;
    private boolean safetyStopped;

    public SyncTally(long apiRequestsAtStart) {
        this.apiRequestsAtStart = apiRequestsAtStart;
    }

    public void fetched(int count) {
        fetched += count;
    }

    public void created(int changesDetected) {
        created++;
        changes += changesDetected;
    }

    public void updated(int changesDetected) {
        updated++;
        changes += changesDetected;
    }

    public void unchanged() {
        unchanged++;
    }

    public void error(String context, Throwable error) {
        errors.add(SyncError.of(context, error));
    }

    public void safetyStop() {
        safetyStopped = true;
    }

    public void cursor(Instant value) {
        cursor = value;
    }

    public boolean isSafetyStopped() {
        return safetyStopped;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int processed() {
        return created + updated + unchanged + errors.size();
    }

    public SyncResult toResult(long apiRequestsNow) {
        return new SyncResult(fetched, created, updated, unchanged, changes, errors,
                Duration.ofNanos(System.nanoTime() - startedNanos),
                cursor != null ? cursor.toString() : null,
                safetyStopped,
                Math.max(0L, apiRequestsNow - apiRequestsAtStart));
    }
}

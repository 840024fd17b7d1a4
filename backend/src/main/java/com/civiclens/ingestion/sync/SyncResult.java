package com.civiclens.ingestion.sync;

import com.civiclens.domain.SyncError;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one resource sync routine.
 *
 * @param cursor        resume token to persist (ISO-8601 instant); null when the mode does not advance a cursor
 * @param safetyStopped stopped early to keep the hourly request budget
 * @param apiRequests   upstream requests issued by this routine
 */
public record SyncResult(
        int recordsFetched,
        int recordsCreated,
        int recordsUpdated,
        int recordsUnchanged,
        int changesDetected,
        List<SyncError> errors,
        Duration duration,
        String cursor,
        boolean safetyStopped,
        long apiRequests
) {

    public SyncResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static SyncResult empty() {
        return new SyncResult(0, 0, 0, 0, 0, List.of(), Duration.ZERO, null, false, 0);
    }

    /** Routine never produced a result: it threw, or was not started. */
    public static SyncResult failed(String context, String message) {
        return new SyncResult(0, 0, 0, 0, 0, List.of(new SyncError(context, message)), Duration.ZERO, null, false, 0);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int recordsProcessed() {
        return recordsCreated + recordsUpdated + recordsUnchanged;
    }
}

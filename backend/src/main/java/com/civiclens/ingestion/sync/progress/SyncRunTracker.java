package com.civiclens.ingestion.sync.progress;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncError;
import com.civiclens.domain.SyncRun;
import com.civiclens.domain.SyncRunRepository;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.sync.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of sync_runs rows: open (RUNNING), progress, then exactly one of complete (COMPLETED/PARTIAL)
 * or fail (FAILED). Also the cursor lookup for the next incremental run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncRunTracker {

    static final String ABANDONED_MESSAGE = "Recovered stale RUNNING run";

    private final SyncRunRepository syncRunRepository;
    private final SyncProperties syncProperties;
    private final Clock clock;

    /**
     * Opens a RUNNING row for the resource. A RUNNING row untouched for longer than {@code staleRunAfter} is
     * marked FAILED first; a live one rejects the call.
     *
     * @throws SyncAlreadyRunningException when another run for the resource is still live
     */
    public SyncRun open(ResourceType resourceType, SyncStrategy strategy) {
        Instant now = clock.instant();
        Optional<SyncRun> running = syncRunRepository.findFirstByResourceTypeAndStatus(resourceType,
                SyncRun.SyncRunStatus.RUNNING);
        if (running.isPresent()) {
            SyncRun existing = running.get();
            Instant lastTouched = existing.getUpdatedAt() != null ? existing.getUpdatedAt() : existing.getStartedAt();
            if (lastTouched != null && lastTouched.isAfter(now.minus(syncProperties.getStaleRunAfter()))) {
                throw new SyncAlreadyRunningException(resourceType, existing.getId());
            }
            log.warn("Marking stale RUNNING {} run {} (last update {}) as FAILED", resourceType, existing.getId(), lastTouched);
            existing.setStatus(SyncRun.SyncRunStatus.FAILED);
            existing.setErrorMessage(ABANDONED_MESSAGE);
            existing.getErrorsEncountered().add(new SyncError("run", ABANDONED_MESSAGE));
            existing.setCompletedAt(now);
            existing.setUpdatedAt(now);
            syncRunRepository.save(existing);
        }
        SyncRun run = new SyncRun();
        run.setResourceType(resourceType);
        run.setStrategy(strategy);
        run.setStatus(SyncRun.SyncRunStatus.RUNNING);
        run.setStartedAt(now);
        run.setUpdatedAt(now);
        try {
            return syncRunRepository.insert(run);
        } catch (DuplicateKeyException e) {
            throw new SyncAlreadyRunningException(resourceType, null);
        }
    }

    /**
     * Cursor of the most recent COMPLETED run of this resource that carries one.
     */
    public Optional<Instant> lastCompletedCursor(ResourceType resourceType) {
        return syncRunRepository
                .findFirstByResourceTypeAndStatusAndCursorIsNotNullOrderByCompletedAtDesc(resourceType,
                        SyncRun.SyncRunStatus.COMPLETED)
                .flatMap(SyncRunTracker::parseCursor);
    }

    /**
     * Persists intermediate counts on the RUNNING row. Ignored for ad-hoc syncs and finished runs.
     */
    public void updateProgress(String runId, SyncResult progress) {
        if (runId == null) {
            return;
        }
        syncRunRepository.findById(runId)
                .filter(run -> !run.isFinished())
                .ifPresent(run -> {
                    applyCounts(run, progress);
                    run.setUpdatedAt(clock.instant());
                    syncRunRepository.save(run);
                });
    }

    /**
     * Finalizes with PARTIAL when the routine recorded any error, COMPLETED otherwise. When the save fails the
     * run is left RUNNING so that {@link #fail} can still finalize it.
     */
    public SyncRun complete(SyncRun run, SyncResult result) {
        requireRunning(run);
        Instant now = clock.instant();
        applyCounts(run, result);
        run.setCursor(result.cursor());
        run.setStatus(result.hasErrors() ? SyncRun.SyncRunStatus.PARTIAL : SyncRun.SyncRunStatus.COMPLETED);
        finish(run, now);
        SyncRun saved;
        try {
            saved = syncRunRepository.save(run);
        } catch (RuntimeException e) {
            reopen(run);
            throw e;
        }
        log.info("{} sync {} finished {}: fetched={} created={} updated={} unchanged={} errors={}{}",
                saved.getResourceType(), saved.getId(), saved.getStatus(), result.recordsFetched(),
                result.recordsCreated(), result.recordsUpdated(), result.recordsUnchanged(), result.errors().size(),
                result.safetyStopped() ? " (safety stop)" : "");
        return saved;
    }

    /**
     * Finalizes as FAILED with the error message and stack trace. Counts persisted by progress updates are kept.
     */
    public SyncRun fail(SyncRun opened, Throwable error) {
        requireRunning(opened);
        SyncRun run = opened.getId() != null ? syncRunRepository.findById(opened.getId()).orElse(opened) : opened;
        Instant now = clock.instant();
        SyncError syncError = SyncError.of("run", error);
        run.setStatus(SyncRun.SyncRunStatus.FAILED);
        run.setErrorMessage(syncError.message());
        run.setErrorStack(stackTraceOf(error));
        run.getErrorsEncountered().add(syncError);
        finish(run, now);
        return syncRunRepository.save(run);
    }

    public List<SyncRun> runsStartedSince(Instant since) {
        return syncRunRepository.findByStartedAtAfterOrderByStartedAtDesc(since);
    }

    private void finish(SyncRun run, Instant now) {
        run.setCompletedAt(now);
        run.setUpdatedAt(now);
        if (run.getStartedAt() != null) {
            run.setDurationMs(Duration.between(run.getStartedAt(), now).toMillis());
        }
    }

    private static void reopen(SyncRun run) {
        run.setStatus(SyncRun.SyncRunStatus.RUNNING);
        run.setCompletedAt(null);
        run.setDurationMs(null);
    }

    private static void applyCounts(SyncRun run, SyncResult result) {
        run.setRecordsFetched(result.recordsFetched());
        run.setRecordsCreated(result.recordsCreated());
        run.setRecordsUpdated(result.recordsUpdated());
        run.setRecordsUnchanged(result.recordsUnchanged());
        run.setChangesDetected(result.changesDetected());
        run.setApiRequestsMade(result.apiRequests());
        run.setSafetyStopped(result.safetyStopped());
        run.setErrorsEncountered(new ArrayList<>(result.errors()));
    }

    private static void requireRunning(SyncRun run) {
        if (run.isFinished()) {
            throw new IllegalStateException("Sync run " + run.getId() + " already finalized as " + run.getStatus());
        }
    }

    private static Optional<Instant> parseCursor(SyncRun run) {
        try {
            return Optional.of(Instant.parse(run.getCursor()));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable cursor '{}' on {} run {}", run.getCursor(), run.getResourceType(), run.getId());
            return Optional.empty();
        }
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}

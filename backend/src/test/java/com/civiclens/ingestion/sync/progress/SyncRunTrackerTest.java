package com.civiclens.ingestion.sync.progress;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncError;
import com.civiclens.domain.SyncRun;
import com.civiclens.domain.SyncRunRepository;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.sync.SyncResult;
import com.civiclens.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncRunTrackerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private SyncRunRepository repository;

    private MutableClock clock;
    private SyncRunTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        SyncProperties properties = new SyncProperties();
        properties.setStaleRunAfter(Duration.ofHours(2));
        tracker = new SyncRunTracker(repository, properties, clock);
        when(repository.insert(any(SyncRun.class))).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            run.setId("run-1");
            return run;
        });
        when(repository.save(any(SyncRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("open inserts a RUNNING row stamped with the start time")
    void open_insertsRunning() {
        when(repository.findFirstByResourceTypeAndStatus(ResourceType.BILLS, SyncRun.SyncRunStatus.RUNNING))
                .thenReturn(Optional.empty());

        SyncRun run = tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);

        assertThat(run.getId()).isEqualTo("run-1");
        assertThat(run.getStatus()).isEqualTo(SyncRun.SyncRunStatus.RUNNING);
        assertThat(run.getStrategy()).isEqualTo(SyncStrategy.INCREMENTAL);
        assertThat(run.getStartedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("open rejects a second sync while a live RUNNING row exists")
    void open_liveRun_rejected() {
        SyncRun live = running("live", T0.minus(Duration.ofMinutes(10)));
        when(repository.findFirstByResourceTypeAndStatus(ResourceType.BILLS, SyncRun.SyncRunStatus.RUNNING))
                .thenReturn(Optional.of(live));

        assertThatThrownBy(() -> tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL))
                .isInstanceOf(SyncAlreadyRunningException.class)
                .hasMessageContaining("live");
        verify(repository, never()).insert(any(SyncRun.class));
    }

    @Test
    @DisplayName("open marks an abandoned RUNNING row FAILED before starting a new run")
    void open_staleRun_recovered() {
        SyncRun stale = running("stale", T0.minus(Duration.ofHours(3)));
        when(repository.findFirstByResourceTypeAndStatus(ResourceType.MEMBERS, SyncRun.SyncRunStatus.RUNNING))
                .thenReturn(Optional.of(stale));

        SyncRun run = tracker.open(ResourceType.MEMBERS, SyncStrategy.FULL);

        assertThat(stale.getStatus()).isEqualTo(SyncRun.SyncRunStatus.FAILED);
        assertThat(stale.getErrorMessage()).isEqualTo(SyncRunTracker.ABANDONED_MESSAGE);
        assertThat(stale.getCompletedAt()).isEqualTo(T0);
        assertThat(run.getStatus()).isEqualTo(SyncRun.SyncRunStatus.RUNNING);
    }

    @Test
    @DisplayName("a concurrent insert losing the unique RUNNING index is reported as already running")
    void open_duplicateKey_rejected() {
        when(repository.findFirstByResourceTypeAndStatus(ResourceType.BILLS, SyncRun.SyncRunStatus.RUNNING))
                .thenReturn(Optional.empty());
        when(repository.insert(any(SyncRun.class))).thenThrow(new DuplicateKeyException("dup"));

        assertThatThrownBy(() -> tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL))
                .isInstanceOf(SyncAlreadyRunningException.class);
    }

    @Test
    @DisplayName("complete without errors is COMPLETED with counts, cursor and duration")
    void complete_noErrors_completed() {
        SyncRun run = running("run-1", T0);
        clock.advance(Duration.ofSeconds(90));
        SyncResult result = new SyncResult(10, 4, 3, 3, 7, List.of(), Duration.ofSeconds(90),
                "2025-03-01T11:00:00Z", false, 42);

        SyncRun done = tracker.complete(run, result);

        assertThat(done.getStatus()).isEqualTo(SyncRun.SyncRunStatus.COMPLETED);
        assertThat(done.getRecordsCreated()).isEqualTo(4);
        assertThat(done.getApiRequestsMade()).isEqualTo(42);
        assertThat(done.getCursor()).isEqualTo("2025-03-01T11:00:00Z");
        assertThat(done.getDurationMs()).isEqualTo(90_000L);
    }

    @Test
    @DisplayName("complete with recorded errors is PARTIAL and keeps them")
    void complete_withErrors_partial() {
        SyncRun run = running("run-1", T0);
        SyncResult result = new SyncResult(2, 1, 0, 0, 1, List.of(new SyncError("119-hr-2", "boom")),
                Duration.ZERO, null, true, 8);

        SyncRun done = tracker.complete(run, result);

        assertThat(done.getStatus()).isEqualTo(SyncRun.SyncRunStatus.PARTIAL);
        assertThat(done.getErrorsEncountered()).containsExactly(new SyncError("119-hr-2", "boom"));
        assertThat(done.isSafetyStopped()).isTrue();
    }

    @Test
    @DisplayName("a run is finalized at most once")
    void complete_twice_rejected() {
        SyncRun run = running("run-1", T0);
        tracker.complete(run, SyncResult.empty());

        assertThatThrownBy(() -> tracker.complete(run, SyncResult.empty()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tracker.fail(run, new RuntimeException("late")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a completion whose save fails leaves the run RUNNING so it can still be failed")
    void complete_saveFails_runStaysOpen() {
        SyncRun run = running("run-1", T0);
        DataAccessResourceFailureException down = new DataAccessResourceFailureException("mongo down");
        when(repository.save(any(SyncRun.class))).thenThrow(down).thenAnswer(inv -> inv.getArgument(0));
        when(repository.findById("run-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tracker.complete(run, SyncResult.empty())).isSameAs(down);

        assertThat(run.getStatus()).isEqualTo(SyncRun.SyncRunStatus.RUNNING);
        assertThat(run.getCompletedAt()).isNull();
        assertThat(run.getDurationMs()).isNull();

        SyncRun failed = tracker.fail(run, down);

        assertThat(failed.getStatus()).isEqualTo(SyncRun.SyncRunStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("mongo down");
    }

    @Test
    @DisplayName("fail reloads the row so persisted progress counts survive")
    void fail_keepsProgress() {
        SyncRun opened = running("run-1", T0);
        SyncRun persisted = running("run-1", T0);
        persisted.setRecordsCreated(12);
        when(repository.findById("run-1")).thenReturn(Optional.of(persisted));
        clock.advance(Duration.ofSeconds(5));

        SyncRun failed = tracker.fail(opened, new IllegalStateException("upstream down"));

        assertThat(failed).isSameAs(persisted);
        assertThat(failed.getStatus()).isEqualTo(SyncRun.SyncRunStatus.FAILED);
        assertThat(failed.getRecordsCreated()).isEqualTo(12);
        assertThat(failed.getErrorMessage()).isEqualTo("upstream down");
        assertThat(failed.getErrorStack()).contains("IllegalStateException");
        assertThat(failed.getDurationMs()).isEqualTo(5_000L);
    }

    @Test
    @DisplayName("progress updates skip ad-hoc and finished runs")
    void updateProgress_onlyRunning() {
        tracker.updateProgress(null, SyncResult.empty());
        verify(repository, never()).findById(any());

        SyncRun finished = running("run-2", T0);
        finished.setStatus(SyncRun.SyncRunStatus.COMPLETED);
        when(repository.findById("run-2")).thenReturn(Optional.of(finished));
        tracker.updateProgress("run-2", SyncResult.empty());
        verify(repository, never()).save(any(SyncRun.class));

        SyncRun live = running("run-3", T0);
        when(repository.findById("run-3")).thenReturn(Optional.of(live));
        clock.advance(Duration.ofMinutes(1));
        tracker.updateProgress("run-3", new SyncResult(5, 5, 0, 0, 5, List.of(), Duration.ZERO, null, false, 30));

        ArgumentCaptor<SyncRun> saved = ArgumentCaptor.forClass(SyncRun.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getRecordsCreated()).isEqualTo(5);
        assertThat(saved.getValue().getUpdatedAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("cursor comes from the latest completed run and unreadable values are ignored")
    void lastCompletedCursor_parses() {
        SyncRun completed = running("c", T0);
        completed.setCursor("2025-02-28T08:30:00Z");
        when(repository.findFirstByResourceTypeAndStatusAndCursorIsNotNullOrderByCompletedAtDesc(ResourceType.BILLS,
                SyncRun.SyncRunStatus.COMPLETED)).thenReturn(Optional.of(completed));
        SyncRun garbled = running("g", T0);
        garbled.setCursor("yesterday");
        when(repository.findFirstByResourceTypeAndStatusAndCursorIsNotNullOrderByCompletedAtDesc(ResourceType.MEMBERS,
                SyncRun.SyncRunStatus.COMPLETED)).thenReturn(Optional.of(garbled));
        when(repository.findFirstByResourceTypeAndStatusAndCursorIsNotNullOrderByCompletedAtDesc(ResourceType.HEARINGS,
                SyncRun.SyncRunStatus.COMPLETED)).thenReturn(Optional.empty());

        assertThat(tracker.lastCompletedCursor(ResourceType.BILLS)).contains(Instant.parse("2025-02-28T08:30:00Z"));
        assertThat(tracker.lastCompletedCursor(ResourceType.MEMBERS)).isEmpty();
        assertThat(tracker.lastCompletedCursor(ResourceType.HEARINGS)).isEmpty();
    }

    private static SyncRun running(String id, Instant startedAt) {
        SyncRun run = new SyncRun();
        run.setId(id);
        run.setResourceType(ResourceType.BILLS);
        run.setStrategy(SyncStrategy.INCREMENTAL);
        run.setStatus(SyncRun.SyncRunStatus.RUNNING);
        run.setStartedAt(startedAt);
        run.setUpdatedAt(startedAt);
        return run;
    }
}

package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncError;
import com.civiclens.domain.SyncRun;
import com.civiclens.domain.SyncRunRepository;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.sync.FetchMode;
import com.civiclens.ingestion.sync.ResourceSyncService;
import com.civiclens.ingestion.sync.SyncRequest;
import com.civiclens.ingestion.sync.SyncResult;
import com.civiclens.ingestion.sync.progress.SyncAlreadyRunningException;
import com.civiclens.ingestion.sync.progress.SyncRunTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private ResourceSyncService bills;
    @Mock
    private ResourceSyncService members;
    @Mock
    private ResourceSyncService hearings;
    @Mock
    private SyncPlanner planner;
    @Mock
    private SyncRunTracker tracker;

    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(bills.resourceType()).thenReturn(ResourceType.BILLS);
        when(members.resourceType()).thenReturn(ResourceType.MEMBERS);
        when(hearings.resourceType()).thenReturn(ResourceType.HEARINGS);
        orchestrator = new SyncOrchestrator(List.of(bills, members, hearings), planner, tracker,
                Clock.fixed(NOW, ZoneOffset.UTC));
        for (ResourceType type : ResourceType.values()) {
            when(tracker.open(eq(type), any())).thenReturn(run(type));
            when(planner.plan(any(), eq(type), eq("run-" + type)))
                    .thenReturn(new SyncRequest("run-" + type, SyncStrategy.INCREMENTAL, FetchMode.CURSOR, null,
                            null, null, 10, null));
        }
    }

    @Test
    @DisplayName("runs resources sequentially in list order, each under its own run")
    void sync_sequentialInOrder() {
        when(bills.sync(any())).thenReturn(result(2, 1, 0));
        when(members.sync(any())).thenReturn(result(1, 0, 0));
        when(hearings.sync(any())).thenReturn(result(0, 3, 0));

        OrchestratorResult result = orchestrator.sync(SyncOptions.incremental());

        InOrder order = inOrder(tracker, bills, members, hearings);
        order.verify(tracker).open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);
        order.verify(bills).sync(any());
        order.verify(tracker).complete(any(), any());
        order.verify(tracker).open(ResourceType.MEMBERS, SyncStrategy.INCREMENTAL);
        order.verify(members).sync(any());
        order.verify(tracker).open(ResourceType.HEARINGS, SyncStrategy.INCREMENTAL);
        order.verify(hearings).sync(any());
        assertThat(result.success()).isTrue();
        assertThat(result.results().keySet())
                .containsExactly(ResourceType.BILLS, ResourceType.MEMBERS, ResourceType.HEARINGS);
        assertThat(result.totals().created()).isEqualTo(3);
        assertThat(result.totals().updated()).isEqualTo(4);
        assertThat(result.failedResource()).isNull();
    }

    @Test
    @DisplayName("record-level errors count in totals without failing the invocation")
    void sync_recordErrors_stillSuccess() {
        when(bills.sync(any())).thenReturn(result(1, 0, 2));

        OrchestratorResult result = orchestrator.sync(SyncOptions.incremental().withResources(List.of(ResourceType.BILLS)));

        assertThat(result.success()).isTrue();
        assertThat(result.totalErrors()).isEqualTo(2);
    }

    @Test
    @DisplayName("a thrown failure marks the run FAILED and stops the remaining resources")
    void sync_failure_stops() {
        RuntimeException boom = new IllegalStateException("upstream down");
        when(bills.sync(any())).thenThrow(boom);

        OrchestratorResult result = orchestrator.sync(SyncOptions.incremental());

        verify(tracker).fail(any(SyncRun.class), eq(boom));
        verify(members, never()).sync(any());
        verify(hearings, never()).sync(any());
        assertThat(result.success()).isFalse();
        assertThat(result.failedResource()).isEqualTo(ResourceType.BILLS);
        assertThat(result.results()).containsOnlyKeys(ResourceType.BILLS);
        assertThat(result.resultFor(ResourceType.BILLS).errors()).extracting(SyncError::message)
                .containsExactly("upstream down");
    }

    @Test
    @DisplayName("continueOnFailure proceeds past a failed resource")
    void sync_failure_continues() {
        when(bills.sync(any())).thenThrow(new IllegalStateException("upstream down"));
        when(members.sync(any())).thenReturn(result(1, 0, 0));
        when(hearings.sync(any())).thenReturn(result(1, 0, 0));

        OrchestratorResult result = orchestrator.sync(SyncOptions.incremental().continuingOnFailure());

        assertThat(result.success()).isFalse();
        assertThat(result.failedResource()).isEqualTo(ResourceType.BILLS);
        assertThat(result.results()).containsOnlyKeys(ResourceType.BILLS, ResourceType.MEMBERS, ResourceType.HEARINGS);
        assertThat(result.totals().created()).isEqualTo(2);
    }

    @Test
    @DisplayName("a sync_runs store that rejects every finalize still yields a structured result for each resource")
    void sync_finalizeFails_stillReturnsResult() {
        SyncRunRepository repository = mock(SyncRunRepository.class);
        when(repository.findFirstByResourceTypeAndStatus(any(), any())).thenReturn(Optional.empty());
        when(repository.insert(any(SyncRun.class))).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            run.setId("run-" + run.getResourceType());
            return run;
        });
        when(repository.findById(any())).thenReturn(Optional.empty());
        when(repository.save(any(SyncRun.class))).thenThrow(new DataAccessResourceFailureException("mongo down"));
        SyncRunTracker realTracker = new SyncRunTracker(repository, new SyncProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        SyncOrchestrator withRealTracker = new SyncOrchestrator(List.of(bills, members, hearings), planner, realTracker,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(bills.sync(any())).thenReturn(result(1, 0, 0));
        when(members.sync(any())).thenReturn(result(1, 0, 0));
        when(hearings.sync(any())).thenReturn(result(1, 0, 0));

        OrchestratorResult result = withRealTracker.sync(SyncOptions.incremental().continuingOnFailure());

        assertThat(result.success()).isFalse();
        assertThat(result.failedResource()).isEqualTo(ResourceType.BILLS);
        assertThat(result.results()).containsOnlyKeys(ResourceType.BILLS, ResourceType.MEMBERS, ResourceType.HEARINGS);
        assertThat(result.resultFor(ResourceType.MEMBERS).errors()).extracting(SyncError::message)
                .containsExactly("mongo down");
        verify(hearings).sync(any());
    }

    @Test
    @DisplayName("a resource already being synced is skipped and the others still run")
    void sync_alreadyRunning_skipped() {
        when(tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL))
                .thenThrow(new SyncAlreadyRunningException(ResourceType.BILLS, "other"));
        when(members.sync(any())).thenReturn(result(0, 0, 0));
        when(hearings.sync(any())).thenReturn(result(0, 0, 0));

        OrchestratorResult result = orchestrator.sync(SyncOptions.incremental());

        verify(bills, never()).sync(any());
        verify(members).sync(any());
        assertThat(result.success()).isFalse();
        assertThat(result.resultFor(ResourceType.BILLS).hasErrors()).isTrue();
    }

    @Test
    @DisplayName("a resource without a routine yields a failed result")
    void sync_missingRoutine() {
        OrchestratorResult result = orchestrator.sync(
                SyncOptions.incremental().withResources(List.of(ResourceType.COMMITTEES)));

        assertThat(result.success()).isFalse();
        assertThat(result.resultFor(ResourceType.COMMITTEES).errors()).hasSize(1);
        verify(tracker, never()).open(eq(ResourceType.COMMITTEES), any());
    }

    @Test
    @DisplayName("two routines for one resource are rejected at construction")
    void duplicateRoutine_rejected() {
        assertThatThrownBy(() -> new SyncOrchestrator(List.of(bills, bills), planner, tracker, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("stats count only COMPLETED runs as successes")
    void stats_successRate() {
        List<SyncRun> runs = new ArrayList<>();
        runs.add(finished(ResourceType.BILLS, SyncRun.SyncRunStatus.COMPLETED, 1_000L, 0));
        runs.add(finished(ResourceType.BILLS, SyncRun.SyncRunStatus.PARTIAL, 3_000L, 2));
        runs.add(finished(ResourceType.MEMBERS, SyncRun.SyncRunStatus.COMPLETED, 2_000L, 0));
        runs.add(finished(ResourceType.HEARINGS, SyncRun.SyncRunStatus.FAILED, null, 1));
        when(tracker.runsStartedSince(NOW.minus(Duration.ofHours(24)))).thenReturn(runs);

        SyncStats stats = orchestrator.getSyncStats(24);

        assertThat(stats.recentSyncs()).isEqualTo(4);
        assertThat(stats.successRate()).isEqualTo(0.5);
        assertThat(stats.avgDurationMs()).isEqualTo(2_000L);
        assertThat(stats.byResource().get(ResourceType.BILLS)).isEqualTo(new SyncStats.ResourceStats(2, 2));
        assertThat(stats.byResource().get(ResourceType.HEARINGS)).isEqualTo(new SyncStats.ResourceStats(1, 1));
    }

    @Test
    @DisplayName("stats over an empty window are zero")
    void stats_empty() {
        when(tracker.runsStartedSince(any())).thenReturn(List.of());

        SyncStats stats = orchestrator.getSyncStats(24);

        assertThat(stats.recentSyncs()).isZero();
        assertThat(stats.successRate()).isZero();
        assertThat(stats.byResource()).isEmpty();
    }

    private static SyncRun run(ResourceType type) {
        SyncRun run = new SyncRun();
        run.setId("run-" + type);
        run.setResourceType(type);
        run.setStatus(SyncRun.SyncRunStatus.RUNNING);
        return run;
    }

    private static SyncRun finished(ResourceType type, SyncRun.SyncRunStatus status, Long durationMs, int errors) {
        SyncRun run = run(type);
        run.setStatus(status);
        run.setDurationMs(durationMs);
        for (int i = 0; i < errors; i++) {
            run.getErrorsEncountered().add(new SyncError("r" + i, "e"));
        }
        return run;
    }

    private static SyncResult result(int created, int updated, int errors) {
        List<SyncError> errorList = new ArrayList<>();
        for (int i = 0; i < errors; i++) {
            errorList.add(new SyncError("r" + i, "failed"));
        }
        return new SyncResult(created + updated, created, updated, 0, created + updated, errorList, Duration.ZERO,
                null, false, 0);
    }
}

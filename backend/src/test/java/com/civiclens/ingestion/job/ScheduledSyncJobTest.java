package com.civiclens.ingestion.job;

import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.config.SyncProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledSyncJobTest {

    @Mock
    private SyncOrchestrator orchestrator;

    @Test
    @DisplayName("a trigger runs an incremental sync over the default resources")
    void trigger_runsIncremental() {
        when(orchestrator.sync(any())).thenReturn(emptyResult(true));
        ScheduledSyncJob job = new ScheduledSyncJob(orchestrator, new SyncProperties());

        job.runScheduled();

        ArgumentCaptor<SyncOptions> options = ArgumentCaptor.forClass(SyncOptions.class);
        verify(orchestrator).sync(options.capture());
        assertThat(options.getValue().strategy()).isEqualTo(SyncStrategy.INCREMENTAL);
        assertThat(options.getValue().resources()).isEqualTo(SyncOptions.DEFAULT_RESOURCES);
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    @DisplayName("disabled schedule does nothing")
    void disabled_skips() {
        SyncProperties properties = new SyncProperties();
        properties.setEnabled(false);

        new ScheduledSyncJob(orchestrator, properties).runScheduled();

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("an overlapping trigger is skipped while the previous one runs")
    void overlappingTrigger_skipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.sync(any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return emptyResult(true);
        });
        ScheduledSyncJob job = new ScheduledSyncJob(orchestrator, new SyncProperties());

        Thread first = new Thread(job::runScheduled);
        first.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        job.runScheduled();
        release.countDown();
        first.join(5_000);

        verify(orchestrator, times(1)).sync(any());
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    @DisplayName("the guard is released when the sync throws")
    void failure_releasesGuard() {
        when(orchestrator.sync(any())).thenThrow(new IllegalStateException("boom"));
        ScheduledSyncJob job = new ScheduledSyncJob(orchestrator, new SyncProperties());

        assertThatThrownBy(job::runScheduled).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(job.isRunning()).isFalse();
    }

    private static OrchestratorResult emptyResult(boolean success) {
        return new OrchestratorResult(SyncStrategy.INCREMENTAL, SyncOptions.DEFAULT_RESOURCES, Map.of(), Duration.ZERO,
                SyncTotals.of(List.of()), 0, success, null);
    }
}

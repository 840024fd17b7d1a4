package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AsyncSyncLauncherTest {

    @Mock
    private SyncOrchestrator orchestrator;

    @Test
    @DisplayName("launch passes the options through and completes with the orchestrator result")
    void launch_completesWithResult() {
        SyncOptions options = SyncOptions.of(SyncStrategy.FULL).withResources(List.of(ResourceType.MEMBERS));
        OrchestratorResult expected = new OrchestratorResult(SyncStrategy.FULL, options.resources(), Map.of(),
                Duration.ZERO, SyncTotals.of(List.of()), 0, true, null);
        when(orchestrator.sync(options)).thenReturn(expected);

        OrchestratorResult result = new AsyncSyncLauncher(orchestrator).launch(options).join();

        assertThat(result).isSameAs(expected);
        verify(orchestrator).sync(options);
    }
}

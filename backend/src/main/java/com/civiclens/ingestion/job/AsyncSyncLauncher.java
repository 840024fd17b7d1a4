package com.civiclens.ingestion.job;

import com.civiclens.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Starts an orchestrator run on the sync-executor pool for manual triggers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AsyncSyncLauncher {

    private final SyncOrchestrator syncOrchestrator;

    @Async(AsyncConfig.SYNC_EXECUTOR)
    public CompletableFuture<OrchestratorResult> launch(SyncOptions options) {
        log.info("Manual {} sync requested for {}", options.strategy(), options.resources());
        return CompletableFuture.completedFuture(syncOrchestrator.sync(options));
    }
}

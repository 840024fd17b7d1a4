package com.civiclens.ingestion.job;

import com.civiclens.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hourly incremental sync. A trigger that fires while the previous one is still running is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledSyncJob {

    private final SyncOrchestrator syncOrchestrator;
    private final SyncProperties syncProperties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${civiclens.sync.cron:0 0 * * * *}")
    public void runScheduled() {
        if (!syncProperties.isEnabled()) {
            log.debug("Scheduled sync disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Previous scheduled sync still running; skipping this trigger");
            return;
        }
        try {
            OrchestratorResult result = syncOrchestrator.sync(SyncOptions.incremental());
            if (!result.success()) {
                log.warn("Scheduled incremental sync did not fully succeed (failed resource: {}, errors: {})",
                        result.failedResource(), result.totalErrors());
            }
        } finally {
            running.set(false);
        }
    }

    boolean isRunning() {
        return running.get();
    }
}

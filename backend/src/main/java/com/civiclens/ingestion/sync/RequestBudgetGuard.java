package com.civiclens.ingestion.sync;

import com.civiclens.common.RateLimitMonitor;
import com.civiclens.common.ThrottleDecision;
import com.civiclens.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Consulted by sync loops before each batch of upstream calls. Sleeps through short throttles; reports a safety
 * stop when the batch would push hourly usage into the reserved margin below the cap, or the throttle is too long.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RequestBudgetGuard {

    private final RateLimitMonitor rateLimitMonitor;
    private final SyncProperties syncProperties;

    /**
     * @param requests upstream calls the next batch will issue
     * @param context  what the batch is for, for logs
     * @return false when the caller must stop paging
     */
    public boolean tryReserve(int requests, String context) {
        ThrottleDecision decision = rateLimitMonitor.shouldThrottle();
        if (decision.throttle()) {
            if (decision.waitMs() > syncProperties.getMaxThrottleWaitMs()) {
                log.warn("Safety stop before {}: throttle of {} ms exceeds max wait ({})",
                        context, decision.waitMs(), decision.reason());
                return false;
            }
            log.info("Throttling {} ms before {}: {}", decision.waitMs(), context, decision.reason());
            if (!sleep(decision.waitMs())) {
                log.warn("Interrupted while throttling before {}", context);
                return false;
            }
        }
        int remaining = rateLimitMonitor.remainingHourlyBudget(syncProperties.getRequestThreshold());
        if (remaining < requests) {
            log.warn("Safety stop before {}: {} request(s) needed, {} left above the {} request reserve",
                    context, requests, Math.max(0, remaining), syncProperties.getRequestThreshold());
            return false;
        }
        return true;
    }

    public long totalRequests() {
        return rateLimitMonitor.getStats().totalRequests();
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.civiclens.ingestion.job;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.sync.FetchMode;
import com.civiclens.ingestion.sync.SyncRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps a strategy and resource to the request its sync routine runs with. Limits and windows come from
 * {@code civiclens.sync.strategy.*}.
 */
@Component
@RequiredArgsConstructor
public class SyncPlanner {

    private final SyncProperties syncProperties;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException for a resource without a sync routine
     */
    public SyncRequest plan(SyncStrategy strategy, ResourceType resourceType, String runId) {
        return switch (resourceType) {
            case BILLS -> planBills(strategy, runId);
            case MEMBERS -> planMembers(strategy, runId);
            case HEARINGS -> planHearings(strategy, runId);
            default -> throw new IllegalArgumentException("No sync plan for " + resourceType);
        };
    }

    private SyncRequest planBills(SyncStrategy strategy, String runId) {
        SyncProperties.Strategy limits = syncProperties.getStrategy();
        Instant now = clock.instant();
        return switch (strategy) {
            case INCREMENTAL -> request(runId, strategy, FetchMode.CURSOR, limits.getIncrementalBillLimit());
            case STALE -> new SyncRequest(runId, strategy, FetchMode.STALE, null, null, null,
                    limits.getStaleBillLimit(), Duration.ofHours(limits.getStaleHours()));
            case PRIORITY -> new SyncRequest(runId, strategy, FetchMode.WINDOW, null,
                    now.minus(Duration.ofDays(limits.getPriorityWindowDays())), now, limits.getPriorityBillLimit(), null);
            case FULL -> new SyncRequest(runId, strategy, FetchMode.CONGRESS, syncProperties.getCurrentCongress(),
                    null, null, limits.getFullBillLimit(), null);
        };
    }

    private SyncRequest planMembers(SyncStrategy strategy, String runId) {
        SyncProperties.Strategy limits = syncProperties.getStrategy();
        return switch (strategy) {
            case INCREMENTAL -> request(runId, strategy, FetchMode.CURSOR, limits.getIncrementalMemberLimit());
            case STALE -> request(runId, strategy, FetchMode.STALE, limits.getMemberRosterLimit());
            case PRIORITY, FULL -> new SyncRequest(runId, strategy, FetchMode.CONGRESS,
                    syncProperties.getCurrentCongress(), null, null, limits.getMemberRosterLimit(), null);
        };
    }

    private SyncRequest planHearings(SyncStrategy strategy, String runId) {
        SyncProperties.Strategy limits = syncProperties.getStrategy();
        Instant now = clock.instant();
        int congress = syncProperties.getCurrentCongress();
        return switch (strategy) {
            case INCREMENTAL, PRIORITY -> new SyncRequest(runId, strategy, FetchMode.WINDOW, congress, now,
                    now.plus(Duration.ofDays(limits.getUpcomingHearingDays())), limits.getHearingLimit(), null);
            case STALE -> new SyncRequest(runId, strategy, FetchMode.WINDOW, congress,
                    now.minus(Duration.ofDays(limits.getRecentHearingDays())), now, limits.getHearingLimit(), null);
            case FULL -> new SyncRequest(runId, strategy, FetchMode.CONGRESS, congress, null, null,
                    limits.getFullHearingLimit(), null);
        };
    }

    private static SyncRequest request(String runId, SyncStrategy strategy, FetchMode mode, int limit) {
        return new SyncRequest(runId, strategy, mode, null, null, null, limit, null);
    }
}

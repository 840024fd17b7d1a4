package com.civiclens.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sync engine config. The hourly cap and threshold mirror the Congress.gov key limit (5000 req/h).
 */
@ConfigurationProperties(prefix = "civiclens.sync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Scheduled incremental sync on/off. Manual and async triggers ignore this flag. */
    private boolean enabled = true;

    /** Cron for the scheduled incremental sync. Default: top of every hour. */
    private String cron = "0 0 * * * *";

    /** Lookback when no completed run carries a cursor. */
    @Min(1)
    private int windowDays = 14;

    /** Bills per list page. */
    @Min(1)
    @Max(250)
    private int pageSize = 250;

    /** Members per list page. */
    @Min(1)
    @Max(250)
    private int memberPageSize = 250;

    /** Hard upstream request cap per rolling hour. */
    @Min(1)
    private int maxRequestsPerHour = 5000;

    /**
     * Safety margin below {@code maxRequestsPerHour}. Paging stops before usage would enter it.
     */
    @Min(0)
    private int requestThreshold = 500;

    /** RUNNING rows without an update for longer than this are treated as abandoned. */
    @NotNull
    private Duration staleRunAfter = Duration.ofHours(2);

    /**
     * Longest throttle pause a sync loop will sleep through. A longer wait ends the run with a safety stop.
     */
    @Min(0)
    private long maxThrottleWaitMs = 60_000;

    /** Congress used by the full strategy and by hearing listings. */
    @Min(1)
    private int currentCongress = 119;

    /** Records between persisted progress updates on the RUNNING row. */
    @Min(1)
    private int progressUpdateEvery = 25;

    @Valid
    private Strategy strategy = new Strategy();

    /**
     * Per-strategy limits and windows used by SyncPlanner.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Strategy {
        @Min(1)
        private int incrementalBillLimit = 200;
        @Min(1)
        private int incrementalMemberLimit = 100;
        @Min(1)
        private int staleHours = 48;
        @Min(1)
        private int staleBillLimit = 100;
        @Min(1)
        private int priorityWindowDays = 90;
        @Min(1)
        private int priorityBillLimit = 250;
        @Min(1)
        private int fullBillLimit = 500;
        @Min(1)
        private int memberRosterLimit = 1000;
        @Min(1)
        private int hearingLimit = 200;
        @Min(1)
        private int fullHearingLimit = 500;
        @Min(1)
        private int upcomingHearingDays = 14;
        @Min(1)
        private int recentHearingDays = 7;
    }
}

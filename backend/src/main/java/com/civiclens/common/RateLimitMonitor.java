package com.civiclens.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Sliding-window accounting of outbound requests against an hourly cap.
 * Keeps one timestamp per request for the last hour; the hourly rate is extrapolated from the last minute
 * so a burst shows up long before the hour fills. Thread-safe; no I/O.
 */
public class RateLimitMonitor {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);
    private static final long REPORTED_WARNING_WAIT_MS = 2_000L;

    static final double CAUTION_RATIO = 0.6;
    static final double WARNING_RATIO = 0.8;
    static final double CRITICAL_RATIO = 0.9;

    private final int hourlyCap;
    private final Clock clock;
    private final Deque<Instant> timestamps = new ArrayDeque<>();
    private long totalRequests;

    private Integer reportedLimit;
    private Integer reportedRemaining;
    private Instant reportedResetAt;
    private Instant backoffUntil;

    public RateLimitMonitor(int hourlyCap) {
        this(hourlyCap, Clock.systemUTC());
    }

    public RateLimitMonitor(int hourlyCap, Clock clock) {
        if (hourlyCap <= 0) {
            throw new IllegalArgumentException("hourlyCap must be positive");
        }
        this.hourlyCap = hourlyCap;
        this.clock = clock;
    }

    public int getHourlyCap() {
        return hourlyCap;
    }

    /**
     * Registers one outbound call at the current instant.
     */
    public synchronized void recordRequest() {
        Instant now = clock.instant();
        prune(now);
        timestamps.addLast(now);
        totalRequests++;
    }

    /**
     * Keeps the budget reported by upstream (x-ratelimit-* headers). Null arguments are ignored.
     */
    public synchronized void recordResponseHeaders(Integer limit, Integer remaining, Long resetEpochSeconds) {
        if (limit != null && limit > 0) {
            reportedLimit = limit;
        }
        if (remaining != null && remaining >= 0) {
            reportedRemaining = remaining;
        }
        if (resetEpochSeconds != null && resetEpochSeconds > 0) {
            reportedResetAt = Instant.ofEpochSecond(resetEpochSeconds);
        }
    }

    /**
     * Upstream answered 429; every throttle check waits out {@code retryAfter} (60s when unknown).
     */
    public synchronized void markRateLimitHit(Duration retryAfter) {
        Duration wait = retryAfter != null && !retryAfter.isNegative() && !retryAfter.isZero()
                ? retryAfter
                : DEFAULT_RETRY_AFTER;
        backoffUntil = clock.instant().plus(wait);
    }

    public synchronized RateLimitStats getStats() {
        Instant now = clock.instant();
        prune(now);
        int lastMinute = countSince(now.minus(MINUTE));
        double averagePerSecond = Math.round(lastMinute / 60.0 * 100.0) / 100.0;
        long estimatedHourly = lastMinute * 60L;
        return new RateLimitStats(totalRequests, lastMinute, timestamps.size(), averagePerSecond,
                estimatedHourly, levelAt(now, estimatedHourly));
    }

    /**
     * Throttle verdict. Fires at {@link WarningLevel#WARNING} or above; the wait lets enough of the last minute
     * age out for the projected hourly rate to fall back under the warning threshold.
     */
    public synchronized ThrottleDecision shouldThrottle() {
        Instant now = clock.instant();
        prune(now);
        if (backoffUntil != null && now.isBefore(backoffUntil)) {
            return ThrottleDecision.waitFor(Duration.between(now, backoffUntil).toMillis(),
                    "Upstream rate limit hit, backing off");
        }
        long estimatedHourly = countSince(now.minus(MINUTE)) * 60L;
        WarningLevel level = levelAt(now, estimatedHourly);
        if (!level.isAtLeast(WarningLevel.WARNING)) {
            return ThrottleDecision.proceed();
        }
        long waitMs = Math.max(millisUntilRateBelow(now, threshold(WARNING_RATIO)), reportedWaitMs(now));
        String reason = level == WarningLevel.CRITICAL ? "Approaching rate limit" : "High request rate detected";
        return ThrottleDecision.waitFor(waitMs,
                reason + " (" + estimatedHourly + "/" + hourlyCap + " req/h projected)");
    }

    /**
     * Requests still available this hour after keeping {@code reserve} in hand. Negative once the reserve is eaten.
     * Uses the tighter of local accounting and the upstream-reported remaining count.
     */
    public synchronized int remainingHourlyBudget(int reserve) {
        Instant now = clock.instant();
        prune(now);
        int local = hourlyCap - reserve - timestamps.size();
        if (reportedRemaining != null && isReportCurrent(now)) {
            return Math.min(local, reportedRemaining - reserve);
        }
        return local;
    }

    public synchronized void reset() {
        timestamps.clear();
        totalRequests = 0;
        reportedLimit = null;
        reportedRemaining = null;
        reportedResetAt = null;
        backoffUntil = null;
    }

    private WarningLevel levelAt(Instant now, long estimatedHourly) {
        WarningLevel estimated;
        if (estimatedHourly >= threshold(CRITICAL_RATIO)) {
            estimated = WarningLevel.CRITICAL;
        } else if (estimatedHourly >= threshold(WARNING_RATIO)) {
            estimated = WarningLevel.WARNING;
        } else if (estimatedHourly >= threshold(CAUTION_RATIO)) {
            estimated = WarningLevel.CAUTION;
        } else {
            estimated = WarningLevel.SAFE;
        }
        return WarningLevel.worst(estimated, reportedLevel(now));
    }

    private WarningLevel reportedLevel(Instant now) {
        if (reportedLimit == null || reportedRemaining == null || !isReportCurrent(now)) {
            return WarningLevel.SAFE;
        }
        double percentRemaining = reportedRemaining * 100.0 / reportedLimit;
        if (percentRemaining < 10) {
            return WarningLevel.CRITICAL;
        }
        if (percentRemaining < 25) {
            return WarningLevel.WARNING;
        }
        return WarningLevel.SAFE;
    }

    private long reportedWaitMs(Instant now) {
        WarningLevel reported = reportedLevel(now);
        if (reported == WarningLevel.CRITICAL && reportedResetAt != null) {
            return Duration.between(now, reportedResetAt).toMillis();
        }
        return reported.isAtLeast(WarningLevel.WARNING) ? REPORTED_WARNING_WAIT_MS : 0L;
    }

    private boolean isReportCurrent(Instant now) {
        return reportedResetAt == null || now.isBefore(reportedResetAt);
    }

    private long threshold(double ratio) {
        return Math.round(hourlyCap * ratio);
    }

    private long millisUntilRateBelow(Instant now, long hourlyThreshold) {
        Instant minuteAgo = now.minus(MINUTE);
        int lastMinute = countSince(minuteAgo);
        long maxAllowed = Math.max(0L, (hourlyThreshold - 1) / 60);
        long excess = lastMinute - maxAllowed;
        if (excess <= 0) {
            return 0L;
        }
        long seen = 0;
        for (Instant ts : timestamps) {
            if (!ts.isAfter(minuteAgo)) {
                continue;
            }
            seen++;
            if (seen == excess) {
                return Duration.between(now, ts.plus(MINUTE)).toMillis() + 1;
            }
        }
        return MINUTE.toMillis();
    }

    private int countSince(Instant cutoff) {
        int count = 0;
        Iterator<Instant> it = timestamps.descendingIterator();
        while (it.hasNext() && it.next().isAfter(cutoff)) {
            count++;
        }
        return count;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(HOUR);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}

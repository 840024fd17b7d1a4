package com.civiclens.common;

import java.time.Duration;

/**
 * Request rates implied by a set of {@link ParallelExecutionOptions}.
 * Burst: how fast starts can be issued while slots are free, bounded only by the start spacing.
 * Sustained: long-run throughput once every slot is busy, bounded by both start spacing and
 * {@code concurrency / latency}.
 */
public record RateProfile(int burstSize, double burstPerSecond, double sustainedPerSecond) {

    public static RateProfile of(ParallelExecutionOptions options, Duration typicalLatency) {
        double startCeiling = options.delayBetweenMs() > 0
                ? 1000.0 / options.delayBetweenMs()
                : Double.POSITIVE_INFINITY;
        long latencyMs = Math.max(1L, typicalLatency.toMillis());
        double slotCeiling = options.concurrency() * 1000.0 / latencyMs;
        return new RateProfile(options.concurrency(), startCeiling, Math.min(startCeiling, slotCeiling));
    }

    public double sustainedPerHour() {
        return sustainedPerSecond * 3600.0;
    }
}

package com.civiclens.common;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Knobs for {@link ParallelExecutor#execute}.
 *
 * @param concurrency    max operations in flight
 * @param delayBetweenMs minimum spacing between successive starts; also the base of the retry backoff
 * @param retry          re-invoke failed operations
 * @param maxRetries     additional attempts after the first one
 * @param retryOn        which failures are worth another attempt
 * @param listeners      progress subscribers
 */
public record ParallelExecutionOptions(
        int concurrency,
        long delayBetweenMs,
        boolean retry,
        int maxRetries,
        Predicate<Throwable> retryOn,
        List<ProgressListener> listeners
) {

    public static final int DEFAULT_CONCURRENCY = 3;
    public static final long DEFAULT_DELAY_BETWEEN_MS = 150L;
    public static final int DEFAULT_MAX_RETRIES = 2;

    public ParallelExecutionOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (delayBetweenMs < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("delayBetweenMs and maxRetries must not be negative");
        }
        retryOn = retryOn != null ? retryOn : e -> true;
        listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    public static ParallelExecutionOptions defaults() {
        return new ParallelExecutionOptions(DEFAULT_CONCURRENCY, DEFAULT_DELAY_BETWEEN_MS, true,
                DEFAULT_MAX_RETRIES, null, null);
    }

    public ParallelExecutionOptions withConcurrency(int value) {
        return new ParallelExecutionOptions(value, delayBetweenMs, retry, maxRetries, retryOn, listeners);
    }

    public ParallelExecutionOptions withDelayBetweenMs(long value) {
        return new ParallelExecutionOptions(concurrency, value, retry, maxRetries, retryOn, listeners);
    }

    public ParallelExecutionOptions withRetry(boolean enabled, int retries) {
        return new ParallelExecutionOptions(concurrency, delayBetweenMs, enabled, retries, retryOn, listeners);
    }

    public ParallelExecutionOptions withRetryOn(Predicate<Throwable> predicate) {
        return new ParallelExecutionOptions(concurrency, delayBetweenMs, retry, maxRetries, predicate, listeners);
    }

    public ParallelExecutionOptions withListener(ProgressListener listener) {
        List<ProgressListener> all = new ArrayList<>(listeners);
        all.add(listener);
        return new ParallelExecutionOptions(concurrency, delayBetweenMs, retry, maxRetries, retryOn, all);
    }

    /** Total attempts an operation may get. */
    public int maxAttempts() {
        return retry ? maxRetries + 1 : 1;
    }
}

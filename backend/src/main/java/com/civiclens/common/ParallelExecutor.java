package com.civiclens.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Runs a list of operations with at most {@code concurrency} in flight, staggered starts and per-operation retry.
 * The calling thread blocks until every operation has finished. Failures never cancel siblings.
 */
@Slf4j
public class ParallelExecutor {

    private static final double RETRY_JITTER = 0.2;

    private final Executor executor;

    public ParallelExecutor(Executor executor) {
        this.executor = executor;
    }

    public <T> ParallelExecutionResult<T> execute(List<? extends Callable<T>> operations,
                                                  ParallelExecutionOptions options) {
        int total = operations.size();
        if (total == 0) {
            return ParallelExecutionResult.empty();
        }
        long startedNanos = System.nanoTime();
        Semaphore slots = new Semaphore(Math.min(options.concurrency(), total));
        RetryPolicy retryPolicy = new RetryPolicy(options.delayBetweenMs(), RETRY_JITTER, options.maxAttempts());
        AtomicReferenceArray<T> results = new AtomicReferenceArray<>(total);
        AtomicReferenceArray<Throwable> failures = new AtomicReferenceArray<>(total);
        ProgressPublisher progress = new ProgressPublisher(total, options.listeners());

        List<CompletableFuture<Void>> futures = new ArrayList<>(total);
        long lastStartNanos = 0L;
        for (int i = 0; i < total; i++) {
            acquire(slots);
            if (i > 0) {
                pauseUntil(lastStartNanos + options.delayBetweenMs() * 1_000_000L);
            }
            lastStartNanos = System.nanoTime();
            int index = i;
            Callable<T> operation = operations.get(i);
            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        runWithRetry(index, operation, options, retryPolicy, results, failures, progress);
                    } finally {
                        slots.release();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                slots.release();
                failures.set(index, e);
                progress.failed();
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<T> resultList = new ArrayList<>(total);
        List<IndexedError> errors = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            resultList.add(results.get(i));
            Throwable failure = failures.get(i);
            if (failure != null) {
                errors.add(new IndexedError(i, failure));
            }
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        return new ParallelExecutionResult<>(resultList, total - errors.size(), errors.size(), errors, duration);
    }

    /**
     * Applies {@code transform} to every item under the same guarantees as {@link #execute}.
     */
    public <I, T> ParallelExecutionResult<T> executeBatch(List<I> items, Function<? super I, ? extends T> transform,
                                                          ParallelExecutionOptions options) {
        List<Callable<T>> operations = new ArrayList<>(items.size());
        for (I item : items) {
            operations.add(() -> transform.apply(item));
        }
        return execute(operations, options);
    }

    private <T> void runWithRetry(int index, Callable<T> operation, ParallelExecutionOptions options,
                                  RetryPolicy retryPolicy, AtomicReferenceArray<T> results,
                                  AtomicReferenceArray<Throwable> failures, ProgressPublisher progress) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                results.set(index, operation.call());
                progress.succeeded();
                return;
            } catch (Exception e) {
                if (!retryPolicy.hasAttemptsLeft(attempts) || !options.retryOn().test(e)) {
                    log.debug("Operation {} failed after {} attempt(s): {}", index, attempts, e.getMessage());
                    failures.set(index, e);
                    progress.failed();
                    return;
                }
                long delayMs = retryPolicy.delayMs(attempts - 1);
                log.debug("Operation {} failed (attempt {}), retrying in {} ms: {}", index, attempts, delayMs, e.getMessage());
                if (!sleep(delayMs)) {
                    failures.set(index, e);
                    progress.failed();
                    return;
                }
            }
        }
    }

    private static void acquire(Semaphore slots) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parallel execution interrupted", e);
        }
    }

    private static void pauseUntil(long deadlineNanos) {
        long waitNanos = deadlineNanos - System.nanoTime();
        if (waitNanos <= 0) {
            return;
        }
        try {
            Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parallel execution interrupted", e);
        }
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Serializes listener calls so {@code finished} is strictly increasing for every subscriber. */
    private static final class ProgressPublisher {

        private final int total;
        private final List<ProgressListener> listeners;
        private int succeeded;
        private int failed;

        private ProgressPublisher(int total, List<ProgressListener> listeners) {
            this.total = total;
            this.listeners = listeners;
        }

        synchronized void succeeded() {
            succeeded++;
            publish();
        }

        synchronized void failed() {
            failed++;
            publish();
        }

        private void publish() {
            ExecutionProgress event = new ExecutionProgress(succeeded + failed, succeeded, failed, total);
            for (ProgressListener listener : listeners) {
                try {
                    listener.onProgress(event);
                } catch (RuntimeException e) {
                    log.warn("Progress listener {} failed at {}/{}", listener, event.finished(), total, e);
                }
            }
        }
    }
}

package com.civiclens.common;

/**
 * Subscriber for {@link ParallelExecutor} progress. Invoked once per finished operation, serially.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ExecutionProgress progress);
}

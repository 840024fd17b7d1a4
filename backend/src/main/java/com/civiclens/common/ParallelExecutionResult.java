package com.civiclens.common;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of {@link ParallelExecutor#execute}. {@code results} is index-aligned with the submitted operations;
 * a failed slot holds null and has a matching entry in {@code errors}.
 */
public record ParallelExecutionResult<T>(
        List<T> results,
        int completed,
        int failed,
        List<IndexedError> errors,
        Duration duration
) {

    public static <T> ParallelExecutionResult<T> empty() {
        return new ParallelExecutionResult<>(List.of(), 0, 0, List.of(), Duration.ZERO);
    }

    public boolean hasErrors() {
        return failed > 0;
    }

    public T get(int index) {
        return results.get(index);
    }
}

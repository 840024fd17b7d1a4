package com.civiclens.common;

/**
 * Progress event: {@code finished} counts successes plus exhausted failures.
 */
public record ExecutionProgress(int finished, int succeeded, int failed, int total) {

    public boolean isDone() {
        return finished == total;
    }
}

package com.civiclens.common;

/**
 * Failure of the operation at {@code index} after all attempts.
 */
public record IndexedError(int index, Throwable error) {

    public String message() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

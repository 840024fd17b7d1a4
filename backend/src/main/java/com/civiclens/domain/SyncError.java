package com.civiclens.domain;

/**
 * One error recorded against a sync run. {@code context} names the record (slug, bioguide id, jacket number)
 * or the step that failed.
 */
public record SyncError(String context, String message) {

    public static SyncError of(String context, Throwable error) {
        String message = error.getMessage();
        if (error.getCause() != null && error.getCause().getMessage() != null
                && !error.getCause().getMessage().isBlank() && !error.getCause().getMessage().equals(message)) {
            message = message + " (" + error.getCause().getMessage() + ")";
        }
        return new SyncError(context, message != null ? message : error.getClass().getSimpleName());
    }
}

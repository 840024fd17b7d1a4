package com.civiclens.ingestion.adapter;

/**
 * Thrown when a Congress.gov call fails. {@code statusCode} is 0 when no HTTP response was received.
 */
public class CongressApiException extends RuntimeException {

    private final int statusCode;
    private final String path;

    public CongressApiException(int statusCode, String path, String message) {
        super(message);
        this.statusCode = statusCode;
        this.path = path;
    }

    public CongressApiException(int statusCode, String path, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.path = path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getPath() {
        return path;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    /** Network failure, timeout, 429 or 5xx: worth another attempt. */
    public boolean isTransient() {
        return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    /** Retry predicate for ParallelExecutor: only transient upstream failures. */
    public static boolean isTransientError(Throwable error) {
        return error instanceof CongressApiException e && e.isTransient();
    }
}

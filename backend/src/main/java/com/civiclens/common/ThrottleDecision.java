package com.civiclens.common;

/**
 * Whether a caller should pause before issuing more requests, and for how long.
 */
public record ThrottleDecision(boolean throttle, long waitMs, String reason) {

    private static final ThrottleDecision PROCEED = new ThrottleDecision(false, 0L, null);

    public static ThrottleDecision proceed() {
        return PROCEED;
    }

    public static ThrottleDecision waitFor(long waitMs, String reason) {
        return new ThrottleDecision(true, Math.max(1L, waitMs), reason);
    }
}

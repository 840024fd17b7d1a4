package com.civiclens.domain;

/**
 * How broadly a sync invocation looks upstream.
 */
public enum SyncStrategy {
    /** Everything updated since the last completed run's cursor. */
    INCREMENTAL,
    /** Records not reconciled for longer than the staleness threshold. */
    STALE,
    /** Recent window with a raised limit. */
    PRIORITY,
    /** Whole current congress. */
    FULL
}

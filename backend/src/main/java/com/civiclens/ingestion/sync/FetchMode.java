package com.civiclens.ingestion.sync;

/**
 * How a resource sync selects upstream records.
 */
public enum FetchMode {
    /** From the last completed run's cursor, else the configured lookback window. */
    CURSOR,
    /** Explicit fromDate/toDate window. */
    WINDOW,
    /** Everything in one congress, up to the limit. */
    CONGRESS,
    /** Local records whose lastSyncedAt is older than the staleness threshold. */
    STALE
}

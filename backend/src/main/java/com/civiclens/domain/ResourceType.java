package com.civiclens.domain;

/**
 * Upstream collections the sync engine knows about. Committees and nominations have no sync routine yet.
 */
public enum ResourceType {
    BILLS,
    MEMBERS,
    HEARINGS,
    COMMITTEES,
    NOMINATIONS
}

package com.civiclens.common;

/**
 * Coarse usage level of the hourly request budget, ordered from least to most severe.
 */
public enum WarningLevel {
    SAFE,
    CAUTION,
    WARNING,
    CRITICAL;

    public boolean isAtLeast(WarningLevel other) {
        return compareTo(other) >= 0;
    }

    public static WarningLevel worst(WarningLevel a, WarningLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}

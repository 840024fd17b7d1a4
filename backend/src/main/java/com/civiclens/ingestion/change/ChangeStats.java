package com.civiclens.ingestion.change;

import com.civiclens.domain.ChangeType;

import java.util.Map;

/**
 * Change-log counts over a time range.
 */
public record ChangeStats(long total, Map<ChangeType, Long> byType, long unnotified) {
}

package com.civiclens.ingestion.change;

import com.civiclens.domain.ChangeType;
import com.civiclens.domain.Significance;

public record DetectedChange(ChangeType changeType, String previousValue, String newValue, Significance significance) {
}

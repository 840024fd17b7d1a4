package com.civiclens.ingestion.store;

import com.civiclens.domain.BillAction;
import com.civiclens.domain.BillCosponsor;
import com.civiclens.domain.BillSubject;
import com.civiclens.domain.BillSummary;
import com.civiclens.domain.BillTextVersion;

import java.util.List;

/**
 * Latest upstream state of a bill's child collections, replaced as a unit.
 */
public record BillChildren(
        List<BillAction> actions,
        List<BillSubject> subjects,
        List<BillSummary> summaries,
        List<BillCosponsor> cosponsors,
        List<BillTextVersion> textVersions
) {

    public BillChildren {
        actions = actions != null ? List.copyOf(actions) : List.of();
        subjects = subjects != null ? List.copyOf(subjects) : List.of();
        summaries = summaries != null ? List.copyOf(summaries) : List.of();
        cosponsors = cosponsors != null ? List.copyOf(cosponsors) : List.of();
        textVersions = textVersions != null ? List.copyOf(textVersions) : List.of();
    }

    public static BillChildren empty() {
        return new BillChildren(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return actions.size() + subjects.size() + summaries.size() + cosponsors.size() + textVersions.size();
    }
}

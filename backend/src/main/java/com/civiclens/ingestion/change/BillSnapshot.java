package com.civiclens.ingestion.change;

import com.civiclens.domain.Bill;

import java.time.LocalDate;

/**
 * Watched top-level fields of a bill, captured before and after reconciliation.
 */
public record BillSnapshot(
        String title,
        String latestActionText,
        LocalDate latestActionDate,
        String lawNumber,
        String sponsorBioguideId,
        String policyArea,
        int cosponsorCount
) {

    public static BillSnapshot of(Bill bill) {
        return new BillSnapshot(
                bill.getTitle(),
                bill.getLatestActionText(),
                bill.getLatestActionDate(),
                bill.getLawNumber(),
                bill.getSponsorBioguideId(),
                bill.getPolicyArea(),
                bill.getCosponsorCount());
    }

    String actionValue() {
        if (latestActionDate == null && latestActionText == null) {
            return null;
        }
        return (latestActionDate != null ? latestActionDate + ": " : "") + (latestActionText != null ? latestActionText : "");
    }
}

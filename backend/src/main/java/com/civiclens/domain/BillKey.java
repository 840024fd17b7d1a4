package com.civiclens.domain;

import java.util.Locale;

/**
 * Natural key of a bill. Bill type is normalized to lower case.
 */
public record BillKey(int congress, String billType, int billNumber) {

    public BillKey {
        if (congress <= 0 || billNumber <= 0 || billType == null || billType.isBlank()) {
            throw new IllegalArgumentException("Invalid bill key " + congress + "/" + billType + "/" + billNumber);
        }
        billType = billType.trim().toLowerCase(Locale.ROOT);
    }

    public String slug() {
        return Bill.slugOf(congress, billType, billNumber);
    }

    /** Congress.gov path, e.g. /bill/119/hr/1234. */
    public String apiPath() {
        return "/bill/" + congress + "/" + billType + "/" + billNumber;
    }

    public static BillKey of(Bill bill) {
        return new BillKey(bill.getCongress(), bill.getBillType(), bill.getBillNumber());
    }

    @Override
    public String toString() {
        return slug();
    }
}

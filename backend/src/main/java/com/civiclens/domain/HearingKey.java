package com.civiclens.domain;

import java.util.Locale;

/**
 * Natural key of a hearing. Chamber is normalized to lower case.
 */
public record HearingKey(int congress, String chamber, int jacketNumber) {

    public HearingKey {
        if (congress <= 0 || jacketNumber <= 0 || chamber == null || chamber.isBlank()) {
            throw new IllegalArgumentException("Invalid hearing key " + congress + "/" + chamber + "/" + jacketNumber);
        }
        chamber = chamber.trim().toLowerCase(Locale.ROOT);
    }

    /** Congress.gov path, e.g. /hearing/119/house/58321. */
    public String apiPath() {
        return "/hearing/" + congress + "/" + chamber + "/" + jacketNumber;
    }

    @Override
    public String toString() {
        return congress + "-" + chamber + "-" + jacketNumber;
    }
}

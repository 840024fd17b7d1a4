package com.civiclens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Bill mirrored from Congress.gov. Natural key (congress, billType, billNumber); slug derived from it.
 * Top-level fields are overwritten on every sync.
 */
@Document(collection = "bills")
@CompoundIndexes({
        @CompoundIndex(name = "natural_key", def = "{'congress': 1, 'billType': 1, 'billNumber': 1}", unique = true),
        @CompoundIndex(name = "staleness", def = "{'lastSyncedAt': 1, 'priority': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Bill {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int congress;
    /** Lower-case bill type, e.g. hr, s, hjres. */
    private String billType;
    private int billNumber;
    @Indexed(unique = true)
    private String slug;
    private String title;
    private String originChamber;
    private LocalDate introducedDate;
    /** Upstream last-modified timestamp; drives the sync cursor. */
    private Instant updateDate;
    private LocalDate latestActionDate;
    private String latestActionText;
    private String policyArea;
    private String sponsorBioguideId;
    private String sponsorFullName;
    private String sponsorParty;
    private String sponsorState;
    /** Resolved local member id; null when the sponsor is not mirrored yet. */
    private String sponsorMemberId;
    private String lawNumber;
    private boolean law;
    private int cosponsorCount;
    private String url;
    /** Higher is synced first among equally stale bills. */
    private int priority;
    private Instant lastSyncedAt;
    private int syncAttempts;
    private Instant createdAt;
    private Instant updatedAt;

    public static String slugOf(int congress, String billType, int billNumber) {
        return congress + "-" + billType.toLowerCase(Locale.ROOT) + "-" + billNumber;
    }
}

package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

@Document(collection = "bill_cosponsors")
@NoArgsConstructor
@Getter
@Setter
public class BillCosponsor {

    @Id
    private String id;
    @Indexed
    private String billId;
    private String bioguideId;
    /** Resolved local member id; null when the member is not mirrored yet. */
    private String memberId;
    private String fullName;
    private String party;
    private String state;
    private LocalDate sponsorshipDate;
    private boolean originalCosponsor;
}

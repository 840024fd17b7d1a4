package com.civiclens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Committee hearing keyed by (congress, chamber, jacketNumber).
 */
@Document(collection = "hearings")
@CompoundIndex(name = "natural_key", def = "{'congress': 1, 'chamber': 1, 'jacketNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Hearing {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int congress;
    private String chamber;
    private int jacketNumber;
    private String title;
    private Instant date;
    private String location;
    private String committeeCode;
    private String committeeName;
    private String url;
    private Instant updateDate;
    private Instant lastSyncedAt;
    private Instant createdAt;
}

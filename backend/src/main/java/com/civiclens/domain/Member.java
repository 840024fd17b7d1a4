package com.civiclens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Member of Congress keyed by bioguide id.
 */
@Document(collection = "members")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Member {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String bioguideId;
    private String firstName;
    private String lastName;
    private String fullName;
    private String state;
    private Integer district;
    private String party;
    private String chamber;
    /** Serving in the current congress. Cleared when a full roster sync no longer returns the member. */
    private boolean current;
    private String imageUrl;
    private String url;
    private Instant updateDate;
    private Instant lastSyncedAt;
    private Instant createdAt;
}

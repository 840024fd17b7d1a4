package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

@Document(collection = "bill_summaries")
@NoArgsConstructor
@Getter
@Setter
public class BillSummary {

    @Id
    private String id;
    @Indexed
    private String billId;
    private String versionCode;
    private LocalDate actionDate;
    private String actionDesc;
    private String text;
    private Instant updateDate;
}

package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "bill_text_versions")
@NoArgsConstructor
@Getter
@Setter
public class BillTextVersion {

    @Id
    private String id;
    @Indexed
    private String billId;
    private String type;
    private Instant date;
    private String pdfUrl;
    private String txtUrl;
    private String xmlUrl;
    private String htmlUrl;
}

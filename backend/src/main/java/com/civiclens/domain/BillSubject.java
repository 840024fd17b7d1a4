package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "bill_subjects")
@NoArgsConstructor
@Getter
@Setter
public class BillSubject {

    @Id
    private String id;
    @Indexed
    private String billId;
    private String name;
    private boolean policyArea;
}

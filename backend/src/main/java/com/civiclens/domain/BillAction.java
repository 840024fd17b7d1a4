package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

@Document(collection = "bill_actions")
@NoArgsConstructor
@Getter
@Setter
public class BillAction {

    @Id
    private String id;
    @Indexed
    private String billId;
    private LocalDate actionDate;
    private String actionCode;
    private String text;
    private String type;
    private String chamber;
    private String sourceSystem;
}

package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only record of one field change on a bill. Only {@code notified} is ever updated.
 */
@Document(collection = "bill_change_log")
@CompoundIndexes({
        @CompoundIndex(name = "bill_detected", def = "{'billId': 1, 'detectedAt': -1}"),
        @CompoundIndex(name = "notified_detected", def = "{'notified': 1, 'detectedAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class BillChangeLog {

    @Id
    private String id;
    private String billId;
    private ChangeType changeType;
    private String previousValue;
    private String newValue;
    private Significance significance;
    private Instant detectedAt;
    private boolean notified;
}

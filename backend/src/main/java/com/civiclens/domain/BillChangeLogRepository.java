package com.civiclens.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface BillChangeLogRepository extends MongoRepository<BillChangeLog, String> {

    List<BillChangeLog> findByNotifiedFalseOrderByDetectedAtAsc(Pageable pageable);

    List<BillChangeLog> findByBillIdOrderByDetectedAtDesc(String billId, Pageable pageable);

    List<BillChangeLog> findByDetectedAtBetween(Instant from, Instant to);

    List<BillChangeLog> findByDetectedAtAfterOrderByDetectedAtDesc(Instant since);
}

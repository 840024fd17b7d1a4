package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillSummaryRepository extends MongoRepository<BillSummary, String> {

    List<BillSummary> findByBillId(String billId);

    long deleteByBillId(String billId);
}

package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillTextVersionRepository extends MongoRepository<BillTextVersion, String> {

    List<BillTextVersion> findByBillId(String billId);

    long deleteByBillId(String billId);
}

package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillActionRepository extends MongoRepository<BillAction, String> {

    List<BillAction> findByBillId(String billId);

    long deleteByBillId(String billId);
}

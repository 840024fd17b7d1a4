package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillCosponsorRepository extends MongoRepository<BillCosponsor, String> {

    List<BillCosponsor> findByBillId(String billId);

    long deleteByBillId(String billId);
}

package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillSubjectRepository extends MongoRepository<BillSubject, String> {

    List<BillSubject> findByBillId(String billId);

    long deleteByBillId(String billId);
}

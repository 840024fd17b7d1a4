package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for bills. Stale selection lives in {@link BillRepositoryCustom}.
 */
public interface BillRepository extends MongoRepository<Bill, String>, BillRepositoryCustom {

    Optional<Bill> findBySlug(String slug);

    Optional<Bill> findByCongressAndBillTypeAndBillNumber(int congress, String billType, int billNumber);
}

package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface HearingRepository extends MongoRepository<Hearing, String> {

    Optional<Hearing> findByCongressAndChamberAndJacketNumber(int congress, String chamber, int jacketNumber);
}

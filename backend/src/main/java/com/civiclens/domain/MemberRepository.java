package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MemberRepository extends MongoRepository<Member, String> {

    Optional<Member> findByBioguideId(String bioguideId);

    /** Members still flagged current but absent from the latest full roster. */
    List<Member> findByCurrentTrueAndBioguideIdNotIn(Collection<String> bioguideIds);
}

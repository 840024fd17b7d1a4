package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface NotificationEventRepository extends MongoRepository<NotificationEvent, String> {

    boolean existsByEventHash(String eventHash);
}

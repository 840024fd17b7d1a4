package com.civiclens.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;

/**
 * MongoTemplate-backed stale query. Mongo sorts missing/null lastSyncedAt before any date in ascending order.
 */
@RequiredArgsConstructor
public class BillRepositoryImpl implements BillRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Bill> findStale(Instant cutoff, int limit) {
        Query query = new Query(new Criteria().orOperator(
                Criteria.where("lastSyncedAt").is(null),
                Criteria.where("lastSyncedAt").lt(cutoff)))
                .with(Sort.by(Sort.Order.asc("lastSyncedAt"), Sort.Order.desc("priority")))
                .limit(Math.max(0, limit));
        return mongoTemplate.find(query, Bill.class);
    }
}

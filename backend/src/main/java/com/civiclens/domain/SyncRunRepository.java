package com.civiclens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for sync_runs. Cursor lookup, overlap guard and stats.
 */
public interface SyncRunRepository extends MongoRepository<SyncRun, String> {

    Optional<SyncRun> findFirstByResourceTypeAndStatus(ResourceType resourceType, SyncRun.SyncRunStatus status);

    /** Latest completed run carrying a cursor (resume point). */
    Optional<SyncRun> findFirstByResourceTypeAndStatusAndCursorIsNotNullOrderByCompletedAtDesc(
            ResourceType resourceType, SyncRun.SyncRunStatus status);

    List<SyncRun> findByStartedAtAfterOrderByStartedAtDesc(Instant since);
}

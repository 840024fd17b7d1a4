package com.civiclens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit row for one invocation of a resource sync routine. At most one RUNNING row per resource type
 * (partial unique index); finalized exactly once by the owning run.
 */
@Document(collection = "sync_runs")
@CompoundIndexes({
        @CompoundIndex(name = "one_running_per_resource", def = "{'resourceType': 1}", unique = true,
                partialFilter = "{ 'status': 'RUNNING' }"),
        @CompoundIndex(name = "resource_status_completed", def = "{'resourceType': 1, 'status': 1, 'completedAt': -1}"),
        @CompoundIndex(name = "started_at", def = "{'startedAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncRun {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private ResourceType resourceType;
    private SyncStrategy strategy;
    private SyncRunStatus status;
    /** ISO-8601 instant of the latest upstream updateDate processed by this run. */
    private String cursor;
    private int recordsFetched;
    private int recordsCreated;
    private int recordsUpdated;
    private int recordsUnchanged;
    private int changesDetected;
    private long apiRequestsMade;
    /** Run stopped early to stay under the hourly request cap. */
    private boolean safetyStopped;
    private List<SyncError> errorsEncountered = new ArrayList<>();
    private String errorMessage;
    private String errorStack;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant completedAt;
    private Long durationMs;

    public boolean isFinished() {
        return status != null && status != SyncRunStatus.RUNNING;
    }

    public enum SyncRunStatus {
        RUNNING,
        COMPLETED,
        PARTIAL,
        FAILED
    }
}

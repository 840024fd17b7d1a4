package com.civiclens.ingestion.sync.progress;

import com.civiclens.domain.ResourceType;
import com.civiclens.domain.SyncError;
import com.civiclens.domain.SyncRun;
import com.civiclens.domain.SyncRunRepository;
import com.civiclens.domain.SyncStrategy;
import com.civiclens.ingestion.sync.SyncResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "civiclens.sync.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
class SyncRunTrackerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    SyncRunTracker tracker;
    @Autowired
    SyncRunRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("the partial unique index allows one RUNNING row per resource")
    void oneRunningPerResource() {
        tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);

        SyncRun second = new SyncRun();
        second.setResourceType(ResourceType.BILLS);
        second.setStatus(SyncRun.SyncRunStatus.RUNNING);
        second.setStartedAt(Instant.now());
        assertThatThrownBy(() -> repository.insert(second)).isInstanceOf(DuplicateKeyException.class);
        assertThatThrownBy(() -> tracker.open(ResourceType.BILLS, SyncStrategy.FULL))
                .isInstanceOf(SyncAlreadyRunningException.class);

        SyncRun members = tracker.open(ResourceType.MEMBERS, SyncStrategy.INCREMENTAL);
        assertThat(members.getId()).isNotNull();
    }

    @Test
    @DisplayName("cursor comes from the newest COMPLETED run; PARTIAL runs are not resume points")
    void cursorFromLatestCompleted() {
        SyncRun first = tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);
        SyncRun firstDone = tracker.complete(first, result("2025-02-01T00:00:00Z", List.of()));
        firstDone.setCompletedAt(firstDone.getCompletedAt().minus(Duration.ofHours(1)));
        repository.save(firstDone);
        SyncRun second = tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);
        tracker.complete(second, result("2025-02-02T00:00:00Z", List.of()));
        SyncRun partial = tracker.open(ResourceType.BILLS, SyncStrategy.INCREMENTAL);
        SyncRun partialDone = tracker.complete(partial, result("2025-02-03T00:00:00Z",
                List.of(new SyncError("119-hr-1", "boom"))));

        assertThat(partialDone.getStatus()).isEqualTo(SyncRun.SyncRunStatus.PARTIAL);

        assertThat(tracker.lastCompletedCursor(ResourceType.BILLS)).contains(Instant.parse("2025-02-02T00:00:00Z"));
        assertThat(tracker.lastCompletedCursor(ResourceType.MEMBERS)).isEmpty();
    }

    private static SyncResult result(String cursor, List<SyncError> errors) {
        return new SyncResult(1, 1, 0, 0, 1, errors, Duration.ZERO, cursor, false, 7);
    }
}

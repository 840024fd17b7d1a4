package com.civiclens.ingestion.sync.hearing;

import com.civiclens.common.IndexedError;
import com.civiclens.common.ParallelExecutionResult;
import com.civiclens.common.ParallelExecutor;
import com.civiclens.domain.Hearing;
import com.civiclens.domain.HearingKey;
import com.civiclens.domain.HearingRepository;
import com.civiclens.domain.ResourceType;
import com.civiclens.ingestion.adapter.CollectionPage;
import com.civiclens.ingestion.adapter.CollectionQuery;
import com.civiclens.ingestion.adapter.CongressApiClient;
import com.civiclens.ingestion.adapter.CongressApiException;
import com.civiclens.ingestion.config.ParallelProperties;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.normalizer.HearingNormalizer;
import com.civiclens.ingestion.sync.FetchMode;
import com.civiclens.ingestion.sync.RequestBudgetGuard;
import com.civiclens.ingestion.sync.ResourceSyncService;
import com.civiclens.ingestion.sync.SyncRequest;
import com.civiclens.ingestion.sync.SyncResult;
import com.civiclens.ingestion.sync.SyncTally;
import com.civiclens.ingestion.sync.progress.SyncRunTracker;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Hearing sync for one congress. Details for each page are fetched in parallel, in chunks no larger than the
 * configured concurrency, with the request budget checked before every chunk.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HearingSyncService implements ResourceSyncService {

    private final CongressApiClient congressApiClient;
    private final HearingRepository hearingRepository;
    private final HearingNormalizer hearingNormalizer;
    private final ParallelExecutor parallelExecutor;
    private final ParallelProperties parallelProperties;
    private final SyncProperties syncProperties;
    private final RequestBudgetGuard requestBudgetGuard;
    private final SyncRunTracker syncRunTracker;
    private final Clock clock;

    @Override
    public ResourceType resourceType() {
        return ResourceType.HEARINGS;
    }

    @Override
    public SyncResult sync(SyncRequest request) {
        SyncTally tally = new SyncTally(requestBudgetGuard.totalRequests());
        if (request.mode() == FetchMode.STALE || request.mode() == FetchMode.CURSOR) {
            log.debug("Hearing sync does not support {} mode; skipping", request.mode());
            return tally.toResult(requestBudgetGuard.totalRequests());
        }
        int congress = request.congress() != null ? request.congress() : syncProperties.getCurrentCongress();
        String path = "/hearing/" + congress;
        CollectionQuery query = CollectionQuery.page(0, Math.max(1, syncProperties.getPageSize()));
        if (request.mode() == FetchMode.WINDOW) {
            query = query.from(request.fromDate()).to(request.toDate());
        }
        int chunkSize = Math.max(1, parallelProperties.getConcurrency());

        int progressEvery = Math.max(1, syncProperties.getProgressUpdateEvery());
        int processed = 0;
        int reportedAt = 0;
        paging:
        while (processed < request.limit()) {
            if (!requestBudgetGuard.tryReserve(1, "hearing page at offset " + query.offset())) {
                tally.safetyStop();
                break;
            }
            CollectionPage page = congressApiClient.fetchPage(path, query);
            tally.fetched(page.items().size());
            List<HearingKey> keys = keysOf(page.items(), request.limit() - processed, tally);
            for (int start = 0; start < keys.size(); start += chunkSize) {
                List<HearingKey> chunk = keys.subList(start, Math.min(keys.size(), start + chunkSize));
                if (!requestBudgetGuard.tryReserve(chunk.size(), "hearing details " + chunk.get(0) + "...")) {
                    tally.safetyStop();
                    break paging;
                }
                processChunk(chunk, tally);
                processed += chunk.size();
                if (request.runId() != null && processed - reportedAt >= progressEvery) {
                    syncRunTracker.updateProgress(request.runId(), tally.toResult(requestBudgetGuard.totalRequests()));
                    reportedAt = processed;
                }
            }
            if (!page.hasNext() || page.items().size() < query.limit()) {
                break;
            }
            query = query.atOffset(query.offset() + page.items().size());
        }
        return tally.toResult(requestBudgetGuard.totalRequests());
    }

    private List<HearingKey> keysOf(List<JsonNode> items, int remaining, SyncTally tally) {
        List<HearingKey> keys = new ArrayList<>();
        for (JsonNode item : items) {
            if (keys.size() >= remaining) {
                break;
            }
            try {
                keys.add(hearingNormalizer.keyOf(item));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable hearing list item: {}", e.getMessage());
                tally.error("hearing", e);
            }
        }
        return keys;
    }

    private void processChunk(List<HearingKey> chunk, SyncTally tally) {
        List<Callable<JsonNode>> operations = new ArrayList<>(chunk.size());
        for (HearingKey key : chunk) {
            operations.add(() -> congressApiClient.fetchDetail(key.apiPath()));
        }
        ParallelExecutionResult<JsonNode> result = parallelExecutor.execute(operations,
                parallelProperties.toOptions().withRetryOn(CongressApiException::isTransientError));
        for (IndexedError error : result.errors()) {
            HearingKey key = chunk.get(error.index());
            log.warn("Hearing {} detail fetch failed: {}", key, error.message());
            tally.error("hearing " + key, error.error());
        }
        for (int i = 0; i < chunk.size(); i++) {
            JsonNode detail = result.get(i);
            if (detail == null) {
                continue;
            }
            HearingKey key = chunk.get(i);
            try {
                reconcile(key, detail, tally);
            } catch (RuntimeException e) {
                log.warn("Hearing {} sync failed: {}", key, e.getMessage());
                tally.error("hearing " + key, e);
            }
        }
    }

    private void reconcile(HearingKey key, JsonNode detail, SyncTally tally) {
        Optional<Hearing> existing = hearingRepository.findByCongressAndChamberAndJacketNumber(
                key.congress(), key.chamber(), key.jacketNumber());
        HearingState previous = existing.map(HearingState::of).orElse(null);
        Hearing hearing = existing.orElseGet(Hearing::new);
        hearingNormalizer.apply(hearing, key, detail);
        Instant now = clock.instant();
        hearing.setLastSyncedAt(now);
        if (hearing.getCreatedAt() == null) {
            hearing.setCreatedAt(now);
        }
        hearingRepository.save(hearing);

        if (previous == null) {
            tally.created(0);
            return;
        }
        int differences = previous.differencesFrom(HearingState.of(hearing));
        if (differences == 0) {
            tally.unchanged();
        } else {
            tally.updated(differences);
        }
    }

    /** Compared fields; text is trimmed, whitespace-collapsed and case-folded, codes are case-folded. */
    record HearingState(String title, Instant date, String location, String committeeCode) {

        static HearingState of(Hearing hearing) {
            return new HearingState(normalizeText(hearing.getTitle()), hearing.getDate(),
                    normalizeText(hearing.getLocation()), normalizeCode(hearing.getCommitteeCode()));
        }

        int differencesFrom(HearingState other) {
            int count = 0;
            count += Objects.equals(title, other.title) ? 0 : 1;
            count += Objects.equals(date, other.date) ? 0 : 1;
            count += Objects.equals(location, other.location) ? 0 : 1;
            count += Objects.equals(committeeCode, other.committeeCode) ? 0 : 1;
            return count;
        }

        private static String normalizeText(String value) {
            if (value == null) {
                return null;
            }
            String collapsed = value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            return collapsed.isEmpty() ? null : collapsed;
        }

        private static String normalizeCode(String value) {
            return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
        }
    }
}

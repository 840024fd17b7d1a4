package com.civiclens.ingestion.sync.bill;

import com.civiclens.common.IndexedError;
import com.civiclens.common.ParallelExecutionOptions;
import com.civiclens.common.ParallelExecutionResult;
import com.civiclens.common.ParallelExecutor;
import com.civiclens.common.RateProfile;
import com.civiclens.domain.Bill;
import com.civiclens.domain.BillCosponsor;
import com.civiclens.domain.BillKey;
import com.civiclens.domain.ChangeType;
import com.civiclens.domain.ResourceType;
import com.civiclens.ingestion.adapter.CollectionPage;
import com.civiclens.ingestion.adapter.CollectionQuery;
import com.civiclens.ingestion.adapter.CongressApiClient;
import com.civiclens.ingestion.adapter.CongressApiException;
import com.civiclens.ingestion.change.BillSnapshot;
import com.civiclens.ingestion.change.ChangeDetectionService;
import com.civiclens.ingestion.change.DetectedChange;
import com.civiclens.ingestion.change.NotificationEventRecorder;
import com.civiclens.ingestion.config.ParallelProperties;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.normalizer.BillNormalizer;
import com.civiclens.ingestion.store.BillChildren;
import com.civiclens.ingestion.store.BillRecordStore;
import com.civiclens.ingestion.store.MemberLookup;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Bill sync: pages /bill by ascending updateDate, enriches each bill with detail and child collections through
 * ParallelExecutor, upserts it with its children replaced, and logs field changes and notification events.
 * Checks the hourly request budget before every page and every bill.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BillSyncService implements ResourceSyncService {

    /** Detail plus actions, subjects, summaries, cosponsors, text versions. */
    static final int ENRICHMENT_REQUESTS = 6;
    private static final int CHILD_PAGE_LIMIT = 250;
    private static final Duration TYPICAL_LATENCY = Duration.ofMillis(400);

    private final CongressApiClient congressApiClient;
    private final BillRecordStore billRecordStore;
    private final BillNormalizer billNormalizer;
    private final ChangeDetectionService changeDetectionService;
    private final NotificationEventRecorder notificationEventRecorder;
    private final MemberLookup memberLookup;
    private final ParallelExecutor parallelExecutor;
    private final ParallelProperties parallelProperties;
    private final SyncProperties syncProperties;
    private final RequestBudgetGuard requestBudgetGuard;
    private final SyncRunTracker syncRunTracker;
    private final Clock clock;

    @Override
    public ResourceType resourceType() {
        return ResourceType.BILLS;
    }

    @Override
    public SyncResult sync(SyncRequest request) {
        SyncTally tally = new SyncTally(requestBudgetGuard.totalRequests());
        RateProfile profile = RateProfile.of(enrichmentOptions(), TYPICAL_LATENCY);
        log.info("Bill sync {} ({}) limit {}: enrichment burst {} req/s, sustained ~{} req/h",
                request.mode(), request.strategy(), request.limit(),
                format(profile.burstPerSecond()), Math.round(profile.sustainedPerHour()));
        if (request.mode() == FetchMode.STALE) {
            syncStale(request, tally);
        } else {
            syncCollection(request, tally);
        }
        return tally.toResult(requestBudgetGuard.totalRequests());
    }

    /**
     * Re-syncs one bill outside any run.
     */
    public SyncResult syncSingleBill(int congress, String billType, int billNumber) {
        SyncTally tally = new SyncTally(requestBudgetGuard.totalRequests());
        BillKey key = new BillKey(congress, billType, billNumber);
        tally.fetched(1);
        if (requestBudgetGuard.tryReserve(ENRICHMENT_REQUESTS, "bill " + key)) {
            reconcileSafely(key, tally);
        } else {
            tally.safetyStop();
        }
        return tally.toResult(requestBudgetGuard.totalRequests());
    }

    private void syncCollection(SyncRequest request, SyncTally tally) {
        Instant previousCursor = request.mode() == FetchMode.CURSOR
                ? syncRunTracker.lastCompletedCursor(ResourceType.BILLS).orElse(null)
                : null;
        Instant fromDate = resolveFromDate(request, previousCursor);
        String path = request.congress() != null ? "/bill/" + request.congress() : "/bill";
        int pageSize = Math.max(1, syncProperties.getPageSize());
        CollectionQuery query = CollectionQuery.page(0, pageSize)
                .from(fromDate)
                .to(request.toDate())
                .sortedBy(CollectionQuery.UPDATE_DATE_ASC);

        Instant latestUpdate = null;
        int processed = 0;
        paging:
        while (processed < request.limit()) {
            if (!requestBudgetGuard.tryReserve(1, "bill page at offset " + query.offset())) {
                tally.safetyStop();
                break;
            }
            CollectionPage page = congressApiClient.fetchPage(path, query);
            tally.fetched(page.items().size());
            for (JsonNode item : page.items()) {
                if (processed >= request.limit()) {
                    break paging;
                }
                if (!requestBudgetGuard.tryReserve(ENRICHMENT_REQUESTS, "bill #" + (processed + 1))) {
                    tally.safetyStop();
                    break paging;
                }
                Instant itemUpdate = processListItem(item, tally);
                if (itemUpdate != null && (latestUpdate == null || itemUpdate.isAfter(latestUpdate))) {
                    latestUpdate = itemUpdate;
                }
                processed++;
                reportProgress(request, tally, processed);
            }
            if (!page.hasNext() || page.items().size() < pageSize) {
                break;
            }
            query = query.atOffset(query.offset() + page.items().size());
        }
        if (request.mode() == FetchMode.CURSOR) {
            tally.cursor(advanceCursor(previousCursor, latestUpdate));
        }
    }

    private void syncStale(SyncRequest request, SyncTally tally) {
        Duration staleAfter = request.staleAfter() != null
                ? request.staleAfter()
                : Duration.ofHours(syncProperties.getStrategy().getStaleHours());
        Instant cutoff = clock.instant().minus(staleAfter);
        List<Bill> stale = billRecordStore.findStale(cutoff, request.limit());
        tally.fetched(stale.size());
        log.info("Bill stale sync: {} bill(s) last synced before {}", stale.size(), cutoff);
        int processed = 0;
        for (Bill bill : stale) {
            BillKey key = BillKey.of(bill);
            if (!requestBudgetGuard.tryReserve(ENRICHMENT_REQUESTS, "stale bill " + key)) {
                tally.safetyStop();
                break;
            }
            reconcileSafely(key, tally);
            processed++;
            reportProgress(request, tally, processed);
        }
    }

    /** Reconciles one list item; returns its updateDate for the cursor, or null when unreadable. */
    private Instant processListItem(JsonNode item, SyncTally tally) {
        BillKey key;
        Instant updateDate;
        try {
            key = billNormalizer.keyOf(item);
            updateDate = billNormalizer.updateDateOf(item);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unreadable bill list item: {}", e.getMessage());
            tally.error("bill", e);
            return null;
        }
        reconcileSafely(key, tally);
        return updateDate;
    }

    private void reconcileSafely(BillKey key, SyncTally tally) {
        try {
            reconcile(key, tally);
        } catch (RuntimeException e) {
            log.warn("Bill {} sync failed: {}", key, e.getMessage());
            tally.error(key.slug(), e);
        }
    }

    private void reconcile(BillKey key, SyncTally tally) {
        BillFetch fetch = fetch(key);
        Optional<Bill> existing = billRecordStore.find(key);
        BillSnapshot previous = existing.map(BillSnapshot::of).orElse(null);
        Bill bill = existing.orElseGet(Bill::new);
        billNormalizer.applyDetail(bill, fetch.detail());
        if (!key.equals(BillKey.of(bill))) {
            throw new IllegalArgumentException("Detail for " + key + " describes " + BillKey.of(bill));
        }
        BillChildren children = fetch.children(billNormalizer);
        resolveMembers(bill, children);
        bill.setLastSyncedAt(clock.instant());
        bill.setSyncAttempts(bill.getSyncAttempts() + 1);
        Bill saved = billRecordStore.save(bill, children);

        List<DetectedChange> changes = changeDetectionService.detectChanges(previous, BillSnapshot.of(saved));
        if (previous == null) {
            changeDetectionService.logChanges(saved.getId(), changes);
            notificationEventRecorder.recordIntroduced(saved);
            tally.created(changes.size());
            return;
        }
        if (changes.isEmpty()) {
            tally.unchanged();
            return;
        }
        changeDetectionService.logChanges(saved.getId(), changes);
        if (changes.stream().anyMatch(c -> c.changeType() == ChangeType.ACTION)) {
            notificationEventRecorder.recordStatusChanged(saved);
        }
        tally.updated(changes.size());
    }

    private BillFetch fetch(BillKey key) {
        String base = key.apiPath();
        CollectionQuery childQuery = CollectionQuery.page(0, CHILD_PAGE_LIMIT);
        List<Callable<JsonNode>> operations = List.of(
                () -> congressApiClient.fetchDetail(base),
                () -> congressApiClient.fetchPage(base + "/actions", childQuery).body(),
                () -> congressApiClient.fetchPage(base + "/subjects", childQuery).body(),
                () -> congressApiClient.fetchPage(base + "/summaries", childQuery).body(),
                () -> congressApiClient.fetchPage(base + "/cosponsors", childQuery).body(),
                () -> congressApiClient.fetchPage(base + "/text", childQuery).body());
        ParallelExecutionResult<JsonNode> result = parallelExecutor.execute(operations, enrichmentOptions());
        if (result.hasErrors()) {
            IndexedError first = result.errors().get(0);
            throw new IllegalStateException("Fetching " + BillFetch.PARTS.get(first.index()) + " for " + key
                    + " failed: " + first.message(), first.error());
        }
        return new BillFetch(result.results());
    }

    private void resolveMembers(Bill bill, BillChildren children) {
        bill.setSponsorMemberId(memberLookup.findMemberId(bill.getSponsorBioguideId()));
        for (BillCosponsor cosponsor : children.cosponsors()) {
            cosponsor.setMemberId(memberLookup.findMemberId(cosponsor.getBioguideId()));
        }
    }

    private ParallelExecutionOptions enrichmentOptions() {
        return parallelProperties.toOptions().withRetryOn(CongressApiException::isTransientError);
    }

    private Instant resolveFromDate(SyncRequest request, Instant previousCursor) {
        return switch (request.mode()) {
            case CURSOR -> previousCursor != null
                    ? previousCursor
                    : clock.instant().minus(Duration.ofDays(syncProperties.getWindowDays()));
            case WINDOW -> request.fromDate();
            default -> null;
        };
    }

    /** Never moves backwards; an empty pass keeps the previous cursor. */
    static Instant advanceCursor(Instant previous, Instant latestProcessed) {
        if (latestProcessed == null) {
            return previous;
        }
        if (previous == null || latestProcessed.isAfter(previous)) {
            return latestProcessed;
        }
        return previous;
    }

    private void reportProgress(SyncRequest request, SyncTally tally, int processed) {
        if (request.runId() != null && processed % Math.max(1, syncProperties.getProgressUpdateEvery()) == 0) {
            syncRunTracker.updateProgress(request.runId(), tally.toResult(requestBudgetGuard.totalRequests()));
        }
    }

    private static String format(double rate) {
        return Double.isInfinite(rate) ? "unbounded" : String.format("%.1f", rate);
    }

    /** Detail and child payloads in the order they were requested. */
    private record BillFetch(List<JsonNode> bodies) {

        static final List<String> PARTS = List.of("detail", "actions", "subjects", "summaries", "cosponsors", "text");

        JsonNode detail() {
            return bodies.get(0);
        }

        BillChildren children(BillNormalizer normalizer) {
            return new BillChildren(
                    normalizer.actions(CollectionPage.fromResponse(bodies.get(1)).items()),
                    normalizer.subjects(bodies.get(2)),
                    normalizer.summaries(CollectionPage.fromResponse(bodies.get(3)).items()),
                    normalizer.cosponsors(CollectionPage.fromResponse(bodies.get(4)).items()),
                    normalizer.textVersions(CollectionPage.fromResponse(bodies.get(5)).items()));
        }
    }
}

package com.civiclens.ingestion.sync.member;

import com.civiclens.domain.Member;
import com.civiclens.domain.MemberRepository;
import com.civiclens.domain.ResourceType;
import com.civiclens.ingestion.adapter.CollectionPage;
import com.civiclens.ingestion.adapter.CollectionQuery;
import com.civiclens.ingestion.adapter.CongressApiClient;
import com.civiclens.ingestion.config.SyncProperties;
import com.civiclens.ingestion.normalizer.MemberNormalizer;
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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Member sync. List items carry everything stored, so one request per page.
 * CURSOR pages members updated since the last cursor; WINDOW and CONGRESS walk the whole current roster and
 * retire members missing from it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemberSyncService implements ResourceSyncService {

    private final CongressApiClient congressApiClient;
    private final MemberRepository memberRepository;
    private final MemberNormalizer memberNormalizer;
    private final SyncProperties syncProperties;
    private final RequestBudgetGuard requestBudgetGuard;
    private final SyncRunTracker syncRunTracker;
    private final Clock clock;

    @Override
    public ResourceType resourceType() {
        return ResourceType.MEMBERS;
    }

    @Override
    public SyncResult sync(SyncRequest request) {
        SyncTally tally = new SyncTally(requestBudgetGuard.totalRequests());
        if (request.mode() == FetchMode.STALE) {
            log.debug("Member sync has no stale mode; skipping");
            return tally.toResult(requestBudgetGuard.totalRequests());
        }
        boolean roster = request.mode() != FetchMode.CURSOR;
        Instant previousCursor = roster ? null : syncRunTracker.lastCompletedCursor(ResourceType.MEMBERS).orElse(null);
        String path = request.congress() != null ? "/member/congress/" + request.congress() : "/member";
        CollectionQuery query = CollectionQuery.page(0, Math.max(1, syncProperties.getMemberPageSize()))
                .param("currentMember", "true");
        if (!roster) {
            query = query.from(previousCursor != null
                            ? previousCursor
                            : clock.instant().minus(Duration.ofDays(syncProperties.getWindowDays())))
                    .sortedBy(CollectionQuery.UPDATE_DATE_ASC);
        }

        Set<String> seen = new HashSet<>();
        Instant latestUpdate = null;
        Instant lastProcessedUpdate = null;
        boolean ascending = true;
        boolean exhausted = false;
        int processed = 0;
        while (processed < request.limit()) {
            if (!requestBudgetGuard.tryReserve(1, "member page at offset " + query.offset())) {
                tally.safetyStop();
                break;
            }
            CollectionPage page = congressApiClient.fetchPage(path, query);
            tally.fetched(page.items().size());
            boolean truncated = false;
            for (JsonNode item : page.items()) {
                if (processed >= request.limit()) {
                    truncated = true;
                    break;
                }
                Instant itemUpdate = reconcileSafely(item, seen, tally);
                if (itemUpdate != null) {
                    if (lastProcessedUpdate != null && itemUpdate.isBefore(lastProcessedUpdate)) {
                        ascending = false;
                    }
                    lastProcessedUpdate = itemUpdate;
                    if (latestUpdate == null || itemUpdate.isAfter(latestUpdate)) {
                        latestUpdate = itemUpdate;
                    }
                }
                processed++;
                reportProgress(request, tally, processed);
            }
            if (!page.hasNext() || page.items().size() < query.limit()) {
                exhausted = !truncated;
                break;
            }
            query = query.atOffset(query.offset() + page.items().size());
        }

        if (roster) {
            if (exhausted && !tally.isSafetyStopped() && !tally.hasErrors()) {
                retireMissing(seen);
            } else {
                log.info("Member roster pass incomplete (exhausted={}, safetyStopped={}, errors={}); not retiring",
                        exhausted, tally.isSafetyStopped(), tally.hasErrors());
            }
        } else if (!tally.isSafetyStopped()) {
            tally.cursor(nextCursor(previousCursor, latestUpdate, exhausted, ascending));
        }
        return tally.toResult(requestBudgetGuard.totalRequests());
    }

    /**
     * A pass cut short by the limit may only move the cursor up to what it processed, and only when the items
     * arrived oldest first; otherwise older unprocessed members could fall below the new cursor.
     */
    static Instant nextCursor(Instant previous, Instant latestProcessed, boolean exhausted, boolean ascending) {
        if (!exhausted && !ascending) {
            log.warn("Member list was cut short and did not arrive in updateDate order; keeping cursor {}", previous);
            return previous;
        }
        if (latestProcessed == null || (previous != null && !latestProcessed.isAfter(previous))) {
            return previous;
        }
        return latestProcessed;
    }

    private Instant reconcileSafely(JsonNode item, Set<String> seen, SyncTally tally) {
        String bioguideId = null;
        try {
            bioguideId = memberNormalizer.bioguideIdOf(item);
            seen.add(bioguideId);
            reconcile(bioguideId, item, tally);
            return memberNormalizer.updateDateOf(item);
        } catch (RuntimeException e) {
            log.warn("Member {} sync failed: {}", bioguideId, e.getMessage());
            tally.error(bioguideId != null ? "member " + bioguideId : "member", e);
            return null;
        }
    }

    private void reconcile(String bioguideId, JsonNode item, SyncTally tally) {
        Optional<Member> existing = memberRepository.findByBioguideId(bioguideId);
        MemberState previous = existing.map(MemberState::of).orElse(null);
        Member member = existing.orElseGet(Member::new);
        memberNormalizer.apply(member, item);
        member.setCurrent(true);
        Instant now = clock.instant();
        member.setLastSyncedAt(now);
        if (member.getCreatedAt() == null) {
            member.setCreatedAt(now);
        }
        memberRepository.save(member);

        if (previous == null) {
            tally.created(0);
            return;
        }
        int differences = previous.differencesFrom(MemberState.of(member));
        if (differences == 0) {
            tally.unchanged();
        } else {
            tally.updated(differences);
        }
    }

    private void retireMissing(Set<String> seen) {
        if (seen.isEmpty()) {
            log.warn("Member roster came back empty; not retiring anyone");
            return;
        }
        List<Member> missing = memberRepository.findByCurrentTrueAndBioguideIdNotIn(seen);
        if (missing.isEmpty()) {
            return;
        }
        missing.forEach(m -> m.setCurrent(false));
        memberRepository.saveAll(missing);
        log.info("Marked {} member(s) absent from the current roster as not current", missing.size());
    }

    private void reportProgress(SyncRequest request, SyncTally tally, int processed) {
        if (request.runId() != null && processed % Math.max(1, syncProperties.getProgressUpdateEvery()) == 0) {
            syncRunTracker.updateProgress(request.runId(), tally.toResult(requestBudgetGuard.totalRequests()));
        }
    }

    /** Fields whose change makes a member count as updated. */
    record MemberState(String fullName, String party, String state, Integer district, String chamber,
                       boolean current, String imageUrl) {

        static MemberState of(Member member) {
            return new MemberState(member.getFullName(), member.getParty(), member.getState(), member.getDistrict(),
                    member.getChamber(), member.isCurrent(), member.getImageUrl());
        }

        int differencesFrom(MemberState other) {
            int count = 0;
            count += Objects.equals(fullName, other.fullName) ? 0 : 1;
            count += Objects.equals(party, other.party) ? 0 : 1;
            count += Objects.equals(state, other.state) ? 0 : 1;
            count += Objects.equals(district, other.district) ? 0 : 1;
            count += Objects.equals(chamber, other.chamber) ? 0 : 1;
            count += current == other.current ? 0 : 1;
            count += Objects.equals(imageUrl, other.imageUrl) ? 0 : 1;
            return count;
        }
    }
}

package com.civiclens.ingestion.change;

import com.civiclens.domain.BillChangeLog;
import com.civiclens.domain.BillChangeLogRepository;
import com.civiclens.domain.ChangeType;
import com.civiclens.domain.Significance;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Field-level diff of bill snapshots and the append-only change log behind it.
 * {@link #detectChanges} is pure; {@link #logChanges} is the explicit persistence step.
 */
@Service
@RequiredArgsConstructor
public class ChangeDetectionService {

    static final String INTRODUCED = "introduced";

    private final BillChangeLogRepository changeLogRepository;
    private final Clock clock;

    /**
     * Watched fields that differ under normalized comparison, one change each. A null {@code previous} means the
     * bill is new and yields a single high-significance STATUS "introduced" change.
     */
    public List<DetectedChange> detectChanges(BillSnapshot previous, BillSnapshot current) {
        if (previous == null) {
            return List.of(new DetectedChange(ChangeType.STATUS, null, INTRODUCED, Significance.HIGH));
        }
        List<DetectedChange> changes = new ArrayList<>();
        if (!sameIdentifier(previous.lawNumber(), current.lawNumber())) {
            changes.add(new DetectedChange(ChangeType.LAW, previous.lawNumber(), current.lawNumber(), Significance.HIGH));
        }
        if (!sameText(previous.latestActionText(), current.latestActionText())
                || !Objects.equals(previous.latestActionDate(), current.latestActionDate())) {
            changes.add(new DetectedChange(ChangeType.ACTION, previous.actionValue(), current.actionValue(), Significance.HIGH));
        }
        if (!sameIdentifier(previous.sponsorBioguideId(), current.sponsorBioguideId())) {
            changes.add(new DetectedChange(ChangeType.SPONSOR, previous.sponsorBioguideId(), current.sponsorBioguideId(),
                    Significance.MEDIUM));
        }
        if (!sameText(previous.title(), current.title())) {
            changes.add(new DetectedChange(ChangeType.TITLE, previous.title(), current.title(), Significance.LOW));
        }
        if (!sameText(previous.policyArea(), current.policyArea())) {
            changes.add(new DetectedChange(ChangeType.POLICY_AREA, previous.policyArea(), current.policyArea(),
                    Significance.LOW));
        }
        if (previous.cosponsorCount() != current.cosponsorCount()) {
            Significance significance = current.cosponsorCount() > previous.cosponsorCount()
                    ? Significance.MEDIUM
                    : Significance.LOW;
            changes.add(new DetectedChange(ChangeType.COSPONSORS, String.valueOf(previous.cosponsorCount()),
                    String.valueOf(current.cosponsorCount()), significance));
        }
        return changes;
    }

    /**
     * Appends one change-log entry per change, unnotified.
     */
    public List<BillChangeLog> logChanges(String billId, List<DetectedChange> changes) {
        if (changes.isEmpty()) {
            return List.of();
        }
        Instant detectedAt = clock.instant();
        List<BillChangeLog> entries = new ArrayList<>(changes.size());
        for (DetectedChange change : changes) {
            BillChangeLog entry = new BillChangeLog();
            entry.setBillId(billId);
            entry.setChangeType(change.changeType());
            entry.setPreviousValue(change.previousValue());
            entry.setNewValue(change.newValue());
            entry.setSignificance(change.significance());
            entry.setDetectedAt(detectedAt);
            entry.setNotified(false);
            entries.add(entry);
        }
        return changeLogRepository.saveAll(entries);
    }

    /** Oldest unnotified changes first. */
    public List<BillChangeLog> getUnnotifiedChanges(int limit) {
        return changeLogRepository.findByNotifiedFalseOrderByDetectedAtAsc(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Sets {@code notified} on the given entries; the only mutation the change log allows.
     *
     * @return number of entries flipped
     */
    public int markAsNotified(Collection<String> changeIds) {
        if (changeIds.isEmpty()) {
            return 0;
        }
        List<BillChangeLog> toUpdate = new ArrayList<>();
        for (BillChangeLog entry : changeLogRepository.findAllById(changeIds)) {
            if (!entry.isNotified()) {
                entry.setNotified(true);
                toUpdate.add(entry);
            }
        }
        changeLogRepository.saveAll(toUpdate);
        return toUpdate.size();
    }

    public List<BillChangeLog> getBillChanges(String billId, int limit) {
        return changeLogRepository.findByBillIdOrderByDetectedAtDesc(billId, PageRequest.of(0, Math.max(1, limit)));
    }

    public ChangeStats getChangeStats(Instant from, Instant to) {
        List<BillChangeLog> entries = changeLogRepository.findByDetectedAtBetween(from, to);
        Map<ChangeType, Long> byType = new EnumMap<>(ChangeType.class);
        long unnotified = 0;
        for (BillChangeLog entry : entries) {
            byType.merge(entry.getChangeType(), 1L, Long::sum);
            if (!entry.isNotified()) {
                unnotified++;
            }
        }
        return new ChangeStats(entries.size(), byType, unnotified);
    }

    /** Distinct bill ids with changes in the last {@code hours}, most recent first. */
    public List<String> getBillsWithRecentChanges(int hours, int limit) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        Set<String> billIds = new LinkedHashSet<>();
        for (BillChangeLog entry : changeLogRepository.findByDetectedAtAfterOrderByDetectedAtDesc(since)) {
            if (billIds.size() >= limit) {
                break;
            }
            billIds.add(entry.getBillId());
        }
        return new ArrayList<>(billIds);
    }

    public Optional<ChangeType> mostSignificantChangeType(List<DetectedChange> changes) {
        return changes.stream()
                .map(DetectedChange::changeType)
                .max(Comparator.comparingInt(ChangeType::priority));
    }

    static boolean sameText(String a, String b) {
        return normalizeText(a).equals(normalizeText(b));
    }

    static boolean sameIdentifier(String a, String b) {
        return normalizeIdentifier(a).equals(normalizeIdentifier(b));
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String normalizeIdentifier(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}

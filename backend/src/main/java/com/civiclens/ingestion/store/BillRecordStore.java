package com.civiclens.ingestion.store;

import com.civiclens.domain.Bill;
import com.civiclens.domain.BillActionRepository;
import com.civiclens.domain.BillCosponsorRepository;
import com.civiclens.domain.BillKey;
import com.civiclens.domain.BillRepository;
import com.civiclens.domain.BillSubjectRepository;
import com.civiclens.domain.BillSummaryRepository;
import com.civiclens.domain.BillTextVersionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Record store for bills: lookup by natural key, upsert, and replace-on-write of child collections.
 * A bill and its children are written in one MongoDB transaction, so no reader sees a bill without children.
 */
@Service
@RequiredArgsConstructor
public class BillRecordStore {

    private final BillRepository billRepository;
    private final BillActionRepository actionRepository;
    private final BillSubjectRepository subjectRepository;
    private final BillSummaryRepository summaryRepository;
    private final BillCosponsorRepository cosponsorRepository;
    private final BillTextVersionRepository textVersionRepository;
    private final Clock clock;

    public Optional<Bill> find(BillKey key) {
        return billRepository.findBySlug(key.slug());
    }

    public List<Bill> findStale(Instant cutoff, int limit) {
        return billRepository.findStale(cutoff, limit);
    }

    /**
     * Upserts the bill (insert when it has no id yet) and replaces all of its children.
     */
    @Transactional
    public Bill save(Bill bill, BillChildren children) {
        Instant now = clock.instant();
        if (bill.getCreatedAt() == null) {
            bill.setCreatedAt(now);
        }
        bill.setUpdatedAt(now);
        Bill saved = billRepository.save(bill);
        replaceChildren(saved.getId(), children);
        return saved;
    }

    /**
     * Replaces every child collection of {@code billId} with {@code children}.
     */
    @Transactional
    public void replaceChildren(String billId, BillChildren children) {
        actionRepository.deleteByBillId(billId);
        subjectRepository.deleteByBillId(billId);
        summaryRepository.deleteByBillId(billId);
        cosponsorRepository.deleteByBillId(billId);
        textVersionRepository.deleteByBillId(billId);

        children.actions().forEach(a -> a.setBillId(billId));
        children.subjects().forEach(s -> s.setBillId(billId));
        children.summaries().forEach(s -> s.setBillId(billId));
        children.cosponsors().forEach(c -> c.setBillId(billId));
        children.textVersions().forEach(t -> t.setBillId(billId));

        if (!children.actions().isEmpty()) {
            actionRepository.saveAll(children.actions());
        }
        if (!children.subjects().isEmpty()) {
            subjectRepository.saveAll(children.subjects());
        }
        if (!children.summaries().isEmpty()) {
            summaryRepository.saveAll(children.summaries());
        }
        if (!children.cosponsors().isEmpty()) {
            cosponsorRepository.saveAll(children.cosponsors());
        }
        if (!children.textVersions().isEmpty()) {
            textVersionRepository.saveAll(children.textVersions());
        }
    }
}

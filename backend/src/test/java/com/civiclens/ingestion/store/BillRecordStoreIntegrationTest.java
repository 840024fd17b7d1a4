package com.civiclens.ingestion.store;

import com.civiclens.domain.Bill;
import com.civiclens.domain.BillAction;
import com.civiclens.domain.BillActionRepository;
import com.civiclens.domain.BillCosponsor;
import com.civiclens.domain.BillCosponsorRepository;
import com.civiclens.domain.BillKey;
import com.civiclens.domain.BillRepository;
import com.civiclens.domain.BillSubject;
import com.civiclens.domain.BillSubjectRepository;
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
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "civiclens.sync.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
class BillRecordStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    BillRecordStore store;
    @Autowired
    BillRepository billRepository;
    @Autowired
    BillActionRepository actionRepository;
    @Autowired
    BillSubjectRepository subjectRepository;
    @Autowired
    BillCosponsorRepository cosponsorRepository;

    @BeforeEach
    void clean() {
        billRepository.deleteAll();
        actionRepository.deleteAll();
        subjectRepository.deleteAll();
        cosponsorRepository.deleteAll();
    }

    @Test
    @DisplayName("saving again replaces children instead of appending to them")
    void save_replacesChildren() {
        Bill bill = bill(1, null);
        Bill saved = store.save(bill, new BillChildren(
                List.of(action("Introduced in House"), action("Referred to committee")),
                List.of(subject("Water quality")), List.of(), List.of(cosponsor("C000001")), List.of()));

        assertThat(saved.getId()).isNotNull();
        assertThat(actionRepository.findByBillId(saved.getId())).hasSize(2);

        store.save(saved, new BillChildren(List.of(action("Passed House")), List.of(), List.of(),
                List.of(cosponsor("C000001"), cosponsor("C000002")), List.of()));

        assertThat(actionRepository.findByBillId(saved.getId())).extracting(BillAction::getText)
                .containsExactly("Passed House");
        assertThat(subjectRepository.findByBillId(saved.getId())).isEmpty();
        assertThat(cosponsorRepository.findByBillId(saved.getId())).hasSize(2);
        assertThat(billRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("natural key lookup finds the stored bill and keeps createdAt across saves")
    void find_byNaturalKey() {
        Bill saved = store.save(bill(7, null), BillChildren.empty());
        Instant createdAt = saved.getCreatedAt();

        Bill found = store.find(new BillKey(119, "HR", 7)).orElseThrow();
        found.setTitle("Renamed");
        store.save(found, BillChildren.empty());

        Bill reloaded = store.find(new BillKey(119, "hr", 7)).orElseThrow();
        assertThat(reloaded.getTitle()).isEqualTo("Renamed");
        assertThat(reloaded.getCreatedAt()).isEqualTo(createdAt);
    }

    @Test
    @DisplayName("a second document with the same natural key is rejected")
    void naturalKey_unique() {
        store.save(bill(9, null), BillChildren.empty());

        assertThatThrownBy(() -> store.save(bill(9, null), BillChildren.empty()))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("stale selection returns never-synced bills first, then oldest, up to the limit")
    void findStale_ordersByLastSynced() {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        store.save(bill(1, now.minus(Duration.ofHours(72))), BillChildren.empty());
        store.save(bill(2, null), BillChildren.empty());
        store.save(bill(3, now.minus(Duration.ofHours(1))), BillChildren.empty());
        store.save(bill(4, now.minus(Duration.ofHours(100))), BillChildren.empty());

        List<Bill> stale = store.findStale(now.minus(Duration.ofHours(48)), 2);

        assertThat(stale).extracting(Bill::getBillNumber).containsExactly(2, 4);
        assertThat(store.findStale(now.minus(Duration.ofHours(48)), 10)).extracting(Bill::getBillNumber)
                .containsExactly(2, 4, 1);
    }

    private static Bill bill(int number, Instant lastSyncedAt) {
        Bill bill = new Bill();
        bill.setCongress(119);
        bill.setBillType("hr");
        bill.setBillNumber(number);
        bill.setSlug(Bill.slugOf(119, "hr", number));
        bill.setTitle("Bill " + number);
        bill.setLastSyncedAt(lastSyncedAt);
        return bill;
    }

    private static BillAction action(String text) {
        BillAction action = new BillAction();
        action.setActionDate(LocalDate.of(2025, 2, 1));
        action.setText(text);
        return action;
    }

    private static BillSubject subject(String name) {
        BillSubject subject = new BillSubject();
        subject.setName(name);
        return subject;
    }

    private static BillCosponsor cosponsor(String bioguideId) {
        BillCosponsor cosponsor = new BillCosponsor();
        cosponsor.setBioguideId(bioguideId);
        return cosponsor;
    }
}

package com.civiclens.ingestion.change;

import com.civiclens.domain.Bill;
import com.civiclens.domain.NotificationEvent;
import com.civiclens.domain.NotificationEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records bill events for the notification collaborator, at most once per semantic event.
 * Introduced events hash {@code type:billId}; status changes also hash the action date.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationEventRecorder {

    static final String SOURCE_BILL = "bill";

    private final NotificationEventRepository notificationEventRepository;
    private final Clock clock;

    /** @return true when a new event was stored */
    public boolean recordIntroduced(Bill bill) {
        NotificationEvent.EventType type = NotificationEvent.EventType.BILL_INTRODUCED;
        return record(type, bill, type.name() + ":" + bill.getId());
    }

    /** @return true when a new event was stored */
    public boolean recordStatusChanged(Bill bill) {
        NotificationEvent.EventType type = NotificationEvent.EventType.BILL_STATUS_CHANGED;
        return record(type, bill, type.name() + ":" + bill.getId() + ":" + bill.getLatestActionDate());
    }

    private boolean record(NotificationEvent.EventType type, Bill bill, String hashInput) {
        String hash = eventHash(hashInput);
        if (notificationEventRepository.existsByEventHash(hash)) {
            return false;
        }
        NotificationEvent event = new NotificationEvent();
        event.setEventType(type);
        event.setSourceType(SOURCE_BILL);
        event.setSourceId(bill.getId());
        event.setEventHash(hash);
        event.setPayload(payloadOf(bill));
        event.setCreatedAt(clock.instant());
        try {
            notificationEventRepository.insert(event);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Event {} for bill {} already recorded concurrently", type, bill.getSlug());
            return false;
        }
    }

    private static Map<String, Object> payloadOf(Bill bill) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("slug", bill.getSlug());
        payload.put("title", bill.getTitle());
        if (bill.getLatestActionDate() != null) {
            payload.put("latestActionDate", bill.getLatestActionDate().toString());
        }
        if (bill.getLatestActionText() != null) {
            payload.put("latestActionText", bill.getLatestActionText());
        }
        return payload;
    }

    static String eventHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

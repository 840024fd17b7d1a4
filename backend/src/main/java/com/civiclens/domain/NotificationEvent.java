package com.civiclens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event for the notification collaborator. {@code eventHash} is unique, so one semantic event is stored once.
 */
@Document(collection = "notification_events")
@NoArgsConstructor
@Getter
@Setter
public class NotificationEvent {

    @Id
    private String id;
    private EventType eventType;
    private String sourceType;
    private String sourceId;
    @Indexed(unique = true)
    private String eventHash;
    private Map<String, Object> payload = new LinkedHashMap<>();
    private Instant createdAt;

    public enum EventType {
        BILL_INTRODUCED,
        BILL_STATUS_CHANGED
    }
}

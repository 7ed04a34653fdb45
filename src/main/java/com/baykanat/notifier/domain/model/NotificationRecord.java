package com.baykanat.notifier.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** notifications tablosu satırı (JDBC, JPA değil). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRecord {

    private String id;
    private String eventId;
    private String eventType;
    private String payload;  // JSONB (String olarak)
    private NotificationStatus status;
    private int attemptCount;
    private Instant lastAttemptTimestamp;
    private Instant createdAt;
}

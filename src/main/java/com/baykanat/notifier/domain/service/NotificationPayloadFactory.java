package com.baykanat.notifier.domain.service;

import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.domain.model.NotificationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/** Event için gönderilecek bildirimi oluşturur. */
@Component
@RequiredArgsConstructor
public class NotificationPayloadFactory {

    static final String NOTIFICATION_ID_PREFIX = "notif-";

    private final Clock clock;

    public static String notificationId(String eventId) {
        return NOTIFICATION_ID_PREFIX + eventId;
    }

    public NotificationPayload create(NotificationEvent event) {
        Map<String, Object> payload = event.getPayload() != null ? event.getPayload() : Map.of();
        return NotificationPayload.builder()
                .notificationId(notificationId(event.getId()))
                .eventId(event.getId())
                .recipient(asString(payload.get("email")))
                .message(String.format("Hello %s, welcome! (Type: %s)",
                        asString(payload.get("username")), event.getEventType()))
                .timestamp(Instant.now(clock).toString())
                .build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}

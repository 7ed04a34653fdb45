package com.baykanat.notifier.domain.service;

import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.domain.model.NotificationPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationPayloadFactoryTest {

    private final NotificationPayloadFactory factory = new NotificationPayloadFactory(
            Clock.fixed(Instant.parse("2026-01-15T10:30:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Renders recipient, greeting and render time from the event")
    void rendersNotification() {
        NotificationEvent event = NotificationEvent.builder()
                .id("evt-1")
                .eventType("user_registered")
                .payload(Map.of("email", "jane@example.com", "username", "jane"))
                .build();

        NotificationPayload notification = factory.create(event);

        assertThat(notification.getNotificationId()).isEqualTo("notif-evt-1");
        assertThat(notification.getEventId()).isEqualTo("evt-1");
        assertThat(notification.getRecipient()).isEqualTo("jane@example.com");
        assertThat(notification.getMessage()).isEqualTo("Hello jane, welcome! (Type: user_registered)");
        assertThat(notification.getTimestamp()).isEqualTo("2026-01-15T10:30:00Z");
    }

    @Test
    @DisplayName("Missing payload leaves the recipient empty")
    void missingPayload() {
        NotificationEvent event = NotificationEvent.builder().id("evt-2").eventType("user_registered").build();

        NotificationPayload notification = factory.create(event);

        assertThat(notification.getRecipient()).isNull();
        assertThat(notification.getMessage()).isEqualTo("Hello null, welcome! (Type: user_registered)");
    }
}

package com.baykanat.notifier.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bir event için gönderim kanalına giden bildirim. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {

    private String notificationId;
    private String eventId;
    private String recipient;
    private String message;
    private String timestamp;
}

package com.baykanat.notifier.api.dto;

import com.baykanat.notifier.domain.model.NotificationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Tek event'in gönderim durumunun ledger görünümü. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Delivery status of an ingested event")
public class NotificationStatusResponse {

    @Schema(description = "Event identity", example = "3f9c2a8e-5d7b-4c1e-9a2f-6b8d0e1f2a3b")
    private String eventId;

    @Schema(description = "Derived notification id", example = "notif-3f9c2a8e-5d7b-4c1e-9a2f-6b8d0e1f2a3b")
    private String notificationId;

    @Schema(description = "Type of the event", example = "user_registered")
    private String eventType;

    @Schema(description = "Ledger status", example = "SENT")
    private NotificationStatus status;

    @Schema(description = "Number of recorded attempts", example = "1")
    private int attemptCount;

    @Schema(description = "Time of the last status change")
    private Instant lastAttemptAt;
}

package com.baykanat.notifier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/** Gelen event payload DTO; API katmanında doğrulama (RabbitMQ'ya göndermeden önce). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event payload for ingestion")
public class EventRequest {

    @Size(max = 128, message = "eventId must be at most 128 characters")
    @Schema(description = "Optional caller-supplied event identity; generated when absent",
            example = "3f9c2a8e-5d7b-4c1e-9a2f-6b8d0e1f2a3b")
    private String eventId;

    @NotBlank(message = "eventType is required")
    @Size(max = 100, message = "eventType must be at most 100 characters")
    @Schema(description = "Type of the event", example = "user_registered")
    private String eventType;

    @NotNull(message = "timestamp is required")
    @Schema(description = "ISO-8601 creation time with offset", example = "2026-01-15T10:30:00Z")
    private OffsetDateTime timestamp;

    @NotNull(message = "payload is required")
    @Valid
    @Schema(description = "Recipient data; extra fields are carried through")
    private EventPayloadRequest payload;
}

package com.baykanat.notifier.domain.mapper;

import com.baykanat.notifier.api.dto.EventPayloadRequest;
import com.baykanat.notifier.api.dto.EventRequest;
import com.baykanat.notifier.api.dto.NotificationStatusResponse;
import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.domain.model.NotificationRecord;
import com.baykanat.notifier.domain.model.NotificationStatus;
import com.baykanat.notifier.domain.service.MalformedEventException;
import com.baykanat.notifier.domain.service.NotificationPayloadFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/** EventRequest → NotificationEvent, mesaj gövdesi → NotificationEvent, event → ledger satırı → status görünümü. */
@Mapper(componentModel = "spring", imports = {NotificationStatus.class, NotificationPayloadFactory.class})
public interface EventMapper {

    /** Broker gövdeleri ve JSONB payload kolonu için ortak ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    /** notifications.event_id ve event_type kolon sınırları. */
    int MAX_EVENT_ID_LENGTH = 128;
    int MAX_EVENT_TYPE_LENGTH = 100;

    /** Atanan kimlikle ve retryCount 0 ile yeni event. */
    @Mapping(target = "id", source = "assignedId")
    @Mapping(target = "eventType", source = "request.eventType")
    @Mapping(target = "timestamp", source = "request.timestamp", qualifiedByName = "isoTimestamp")
    @Mapping(target = "payload", source = "request.payload", qualifiedByName = "toPayloadMap")
    @Mapping(target = "retryCount", constant = "0")
    NotificationEvent toNotificationEvent(EventRequest request, String assignedId);

    /** attempt_count 0 ile QUEUED ledger satırı. */
    @Mapping(target = "id", expression = "java(NotificationPayloadFactory.notificationId(event.getId()))")
    @Mapping(target = "eventId", source = "id")
    @Mapping(target = "payload", source = "payload", qualifiedByName = "toJsonString")
    @Mapping(target = "status", expression = "java(NotificationStatus.QUEUED)")
    @Mapping(target = "attemptCount", constant = "0")
    @Mapping(target = "lastAttemptTimestamp", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    NotificationRecord toLedgerRecord(NotificationEvent event);

    @Mapping(target = "notificationId", source = "id")
    @Mapping(target = "lastAttemptAt", source = "lastAttemptTimestamp")
    NotificationStatusResponse toStatusResponse(NotificationRecord record);

    /** Broker gövdesi → event; parse edilemeyen JSON, boş/uzun id, boş/uzun eventType veya negatif retryCount malformed. */
    default NotificationEvent fromMessageBody(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedEventException("Empty message body");
        }
        NotificationEvent event;
        try {
            event = JSON_MAPPER.readValue(body, NotificationEvent.class);
        } catch (IOException e) {
            throw new MalformedEventException("Unparseable message body: " + e.getMessage(), e);
        }
        if (event == null || event.getId() == null || event.getId().isBlank()) {
            throw new MalformedEventException("Message has no event id");
        }
        if (event.getId().length() > MAX_EVENT_ID_LENGTH) {
            throw new MalformedEventException("Event id longer than " + MAX_EVENT_ID_LENGTH + " characters");
        }
        if (event.getEventType() == null || event.getEventType().isBlank()) {
            throw new MalformedEventException("Message has no eventType for event " + event.getId());
        }
        if (event.getEventType().length() > MAX_EVENT_TYPE_LENGTH) {
            throw new MalformedEventException("eventType longer than " + MAX_EVENT_TYPE_LENGTH
                    + " characters for event " + event.getId());
        }
        if (event.getRetryCount() < 0) {
            throw new MalformedEventException("Negative retryCount for event " + event.getId());
        }
        return event;
    }

    @Named("isoTimestamp")
    default String isoTimestamp(OffsetDateTime timestamp) {
        if (timestamp == null) return null;
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timestamp);
    }

    /** Tipli payload → düz map, ekstra alanlar dahil. */
    @Named("toPayloadMap")
    default Map<String, Object> toPayloadMap(EventPayloadRequest payload) {
        if (payload == null) return null;
        return JSON_MAPPER.convertValue(payload, PAYLOAD_TYPE);
    }

    @Named("toJsonString")
    default String toJsonString(Map<String, Object> payload) {
        if (payload == null) return null;
        try {
            return JSON_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload serialization failed", e);
        }
    }
}

package com.baykanat.notifier.api.controller;

import com.baykanat.notifier.api.dto.BulkEventRequest;
import com.baykanat.notifier.api.dto.EventRequest;
import com.baykanat.notifier.api.dto.EventResponse;
import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.domain.service.EventIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** POST /events ve POST /events/bulk. Event RabbitMQ'ya gönderilir, 202 döner; gönderim consumer'da. */
@Slf4j
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Event Ingestion", description = "Endpoints for ingesting events into the notification pipeline")
public class EventController {

    private final EventIngestionService ingestionService;

    /** Tek event alır, doğrular, kuyruğa gönderir. Geçersiz payload → 400, geçerli → 202 ve event id. */
    @PostMapping
    @Operation(summary = "Ingest a single event", description = "Accepts and queues a single event for notification delivery")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable (RabbitMQ down)")
    })
    public ResponseEntity<EventResponse> ingestEvent(@Valid @RequestBody EventRequest event) {
        log.debug("Received event: eventType={}, eventId={}", event.getEventType(), event.getEventId());

        NotificationEvent queued = ingestionService.ingest(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Event queued for processing")
                        .eventIds(List.of(queued.getId()))
                        .build());
    }

    /** En fazla 1000 event; hepsi doğrulanır, confirm'ler paralel beklenir. */
    @PostMapping("/bulk")
    @Operation(summary = "Bulk ingest events", description = "Accepts up to 1000 events for notification delivery")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    public ResponseEntity<EventResponse> ingestBulkEvents(@Valid @RequestBody BulkEventRequest bulkRequest) {
        log.debug("Received bulk request with {} events", bulkRequest.getEvents().size());

        List<NotificationEvent> queued = ingestionService.ingestBatch(bulkRequest.getEvents());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("accepted")
                        .acceptedCount(queued.size())
                        .message("Events queued for processing")
                        .eventIds(queued.stream().map(NotificationEvent::getId).toList())
                        .build());
    }
}

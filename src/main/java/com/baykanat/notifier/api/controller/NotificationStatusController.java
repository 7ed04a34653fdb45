package com.baykanat.notifier.api.controller;

import com.baykanat.notifier.api.dto.NotificationStatusResponse;
import com.baykanat.notifier.domain.service.NotificationStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** GET /events/{eventId}/status; idempotency ledger'dan okur. */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Delivery Status", description = "Ledger view of ingested events")
public class NotificationStatusController {

    private final NotificationStatusService statusService;

    @GetMapping("/{eventId}/status")
    @Operation(summary = "Get delivery status", description = "Returns the ledger status and attempt count of an event")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status found"),
            @ApiResponse(responseCode = "404", description = "Event not consumed yet or unknown")
    })
    public ResponseEntity<NotificationStatusResponse> getStatus(
            @Parameter(description = "Event id returned at ingestion", required = true)
            @PathVariable("eventId") String eventId) {
        return ResponseEntity.ok(statusService.getStatus(eventId));
    }
}

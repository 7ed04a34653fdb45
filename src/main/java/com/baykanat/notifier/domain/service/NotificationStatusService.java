package com.baykanat.notifier.domain.service;

import com.baykanat.notifier.api.dto.NotificationStatusResponse;
import com.baykanat.notifier.api.exception.NotificationNotFoundException;
import com.baykanat.notifier.domain.mapper.EventMapper;
import com.baykanat.notifier.infrastructure.persistence.NotificationJdbcRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Ledger okuma tarafı: alınan event'in nihai SENT / FAILED_DLQ sonucu. */
@Service
@RequiredArgsConstructor
public class NotificationStatusService {

    private final NotificationJdbcRepository ledger;
    private final EventMapper eventMapper;

    public NotificationStatusResponse getStatus(String eventId) {
        return ledger.findByEventId(eventId)
                .map(eventMapper::toStatusResponse)
                .orElseThrow(() -> new NotificationNotFoundException(eventId));
    }
}

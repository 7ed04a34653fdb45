package com.baykanat.notifier.domain.service;

import com.baykanat.notifier.api.dto.EventRequest;
import com.baykanat.notifier.domain.mapper.EventMapper;
import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.infrastructure.amqp.NotificationEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/** Producer tarafı: event kimliğini bir kez atar, ana kuyruğa persistent publish eder. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionService {

    private final NotificationEventPublisher publisher;
    private final EventMapper eventMapper;

    /** İstemcinin verdiği eventId korunur, yoksa random UUID. Gönderilen event'i döner. */
    public NotificationEvent ingest(EventRequest request) {
        NotificationEvent event = eventMapper.toNotificationEvent(request, assignId(request));
        publisher.publish(event);
        log.info("Event {} of type {} queued", event.getId(), event.getEventType());
        return event;
    }

    /** Her istek için ingest ile aynı; confirm'ler birlikte beklenir. */
    public List<NotificationEvent> ingestBatch(List<EventRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        List<NotificationEvent> events = requests.stream()
                .map(request -> eventMapper.toNotificationEvent(request, assignId(request)))
                .toList();
        publisher.publishBatch(events);
        log.info("Batch of {} events queued", events.size());
        return events;
    }

    private String assignId(EventRequest request) {
        String supplied = request.getEventId();
        return supplied != null && !supplied.isBlank() ? supplied.trim() : UUID.randomUUID().toString();
    }
}

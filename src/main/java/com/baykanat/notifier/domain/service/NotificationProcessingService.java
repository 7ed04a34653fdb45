package com.baykanat.notifier.domain.service;

import com.baykanat.notifier.config.AppProperties;
import com.baykanat.notifier.domain.mapper.EventMapper;
import com.baykanat.notifier.domain.model.NotificationEvent;
import com.baykanat.notifier.domain.model.NotificationPayload;
import com.baykanat.notifier.domain.model.NotificationStatus;
import com.baykanat.notifier.domain.model.ProcessingOutcome;
import com.baykanat.notifier.infrastructure.amqp.DelayTierRouter;
import com.baykanat.notifier.infrastructure.amqp.NotificationEventPublisher;
import com.baykanat.notifier.infrastructure.delivery.NotificationSender;
import com.baykanat.notifier.infrastructure.persistence.NotificationJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Mesaj başına state machine: parse, idempotency kontrolü, gönderim, ardından SENT / retry tier / DLQ.
 *
 * <p>Dönen her sonuç mesajın ack'lenebileceği anlamına gelir. Ledger ve broker hataları burada
 * yakalanmaz; listener'a kadar çıkar, mesaj ack'lenmez ve broker event'in retry hakkını
 * harcamadan tekrar teslim eder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationProcessingService {

    private final NotificationJdbcRepository ledger;
    private final NotificationEventPublisher publisher;
    private final NotificationSender sender;
    private final NotificationPayloadFactory payloadFactory;
    private final DelayTierRouter tierRouter;
    private final EventMapper eventMapper;
    private final AppProperties appProperties;

    public ProcessingOutcome process(byte[] body) {
        NotificationEvent event;
        try {
            event = eventMapper.fromMessageBody(body);
        } catch (MalformedEventException e) {
            log.error("Dropping malformed message: {}", e.getMessage());
            return ProcessingOutcome.DROPPED_MALFORMED;
        }
        return process(event);
    }

    public ProcessingOutcome process(NotificationEvent event) {
        String eventId = event.getId();
        log.debug("Processing event {} (retryCount={})", eventId, event.getRetryCount());

        if (ledger.isHandled(eventId)) {
            log.info("Event {} already handled, skipping", eventId);
            return ProcessingOutcome.SKIPPED;
        }

        ledger.createIfAbsent(eventMapper.toLedgerRecord(event));

        try {
            NotificationPayload notification = payloadFactory.create(event);
            sender.send(notification);
        } catch (RuntimeException e) {
            return handleDeliveryFailure(event, e);
        }

        ledger.updateStatus(eventId, NotificationStatus.SENT);
        log.info("Event {} delivered", eventId);
        return ProcessingOutcome.SENT;
    }

    private ProcessingOutcome handleDeliveryFailure(NotificationEvent event, RuntimeException cause) {
        String eventId = event.getId();
        int maxRetries = appProperties.getDelivery().getMaxRetries();
        log.warn("Delivery failed for event {}: {}", eventId, cause.getMessage());

        if (event.getRetryCount() < maxRetries) {
            NotificationEvent retry = event.withNextRetry();
            long delayMs = tierRouter.delayForRetry(retry.getRetryCount());
            log.info("Scheduling retry {}/{} for event {} in {}ms",
                    retry.getRetryCount(), maxRetries, eventId, delayMs);

            ledger.updateStatus(eventId, NotificationStatus.FAILED_RETRYING);
            publisher.publishRetry(retry, delayMs);
            return ProcessingOutcome.RETRY_SCHEDULED;
        }

        log.error("Max retries ({}) reached for event {}, moving to dead letter queue", maxRetries, eventId);
        // Önce DLQ kopyası, sonra terminal durum: publish hata verirse redelivery tekrar dener
        publisher.publishDeadLetter(event);
        ledger.updateStatus(eventId, NotificationStatus.FAILED_DLQ);
        return ProcessingOutcome.DEAD_LETTERED;
    }
}

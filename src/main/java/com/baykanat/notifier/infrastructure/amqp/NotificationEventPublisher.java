package com.baykanat.notifier.infrastructure.amqp;

import com.baykanat.notifier.config.AppProperties;
import com.baykanat.notifier.domain.model.NotificationEvent;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ana kuyruğa, retry exchange'e ve DLQ'ya persistent publish.
 * Her publish broker'ın publisher confirm'ini bekler (kuyruğa yazıldı, uçtan uca teslim değil).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationEventPublisher {

    private static final String DEFAULT_EXCHANGE = "";
    private static final long BATCH_CONFIRM_TIMEOUT_SECONDS = 10;

    private static final MessagePostProcessor PERSISTENT = message -> {
        message.getMessageProperties().setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        return message;
    };

    private final RabbitTemplate rabbitTemplate;
    private final AppProperties appProperties;
    private final DelayTierRouter tierRouter;

    /** Ana kuyruğa ingestion publish; Retry + Circuit Breaker, tükenince 503. */
    @Retry(name = "rabbitProducer")
    @CircuitBreaker(name = "rabbitProducer", fallbackMethod = "handlePublishFailure")
    public void publish(NotificationEvent event) {
        CorrelationData correlation = send(DEFAULT_EXCHANGE, appProperties.getRabbit().getMainQueue(), event);
        awaitConfirm(correlation, appProperties.getRabbit().getConfirmTimeout().toMillis());
        log.debug("Published event {} to {}", event.getId(), appProperties.getRabbit().getMainQueue());
    }

    /** Önce tüm event'leri gönderir, sonra tüm confirm'leri paralel bekler. */
    @CircuitBreaker(name = "rabbitProducer", fallbackMethod = "handleBatchPublishFailure")
    public void publishBatch(List<NotificationEvent> events) {
        String mainQueue = appProperties.getRabbit().getMainQueue();
        List<CorrelationData> correlations = events.stream()
                .map(event -> send(DEFAULT_EXCHANGE, mainQueue, event))
                .toList();

        CompletableFuture<?>[] futures = correlations.stream()
                .map(CorrelationData::getFuture)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(BATCH_CONFIRM_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpException("Interrupted while waiting for publisher confirms", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AmqpException("Publisher confirms not received for batch of " + events.size(), e);
        }
        for (CorrelationData correlation : correlations) {
            checkAck(correlation, correlation.getFuture().join());
        }
    }

    /** Kopyayı istenen gecikme için seçilen delay tier'a yönlendirir. */
    public void publishRetry(NotificationEvent event, long delayMs) {
        String routingKey = tierRouter.routingKeyFor(delayMs);
        CorrelationData correlation = send(appProperties.getRabbit().getRetryExchange(), routingKey, event);
        awaitConfirm(correlation, appProperties.getRabbit().getConfirmTimeout().toMillis());
        log.debug("Published event {} to {} with routing key {}",
                event.getId(), appProperties.getRabbit().getRetryExchange(), routingKey);
    }

    public void publishDeadLetter(NotificationEvent event) {
        String deadLetterQueue = appProperties.getRabbit().getDeadLetterQueue();
        CorrelationData correlation = send(DEFAULT_EXCHANGE, deadLetterQueue, event);
        awaitConfirm(correlation, appProperties.getRabbit().getConfirmTimeout().toMillis());
        log.debug("Published event {} to {}", event.getId(), deadLetterQueue);
    }

    private CorrelationData send(String exchange, String routingKey, NotificationEvent event) {
        CorrelationData correlation = new CorrelationData(event.getId() + ":" + event.getRetryCount());
        rabbitTemplate.convertAndSend(exchange, routingKey, event, PERSISTENT, correlation);
        return correlation;
    }

    private void awaitConfirm(CorrelationData correlation, long timeoutMs) {
        CorrelationData.Confirm confirm;
        try {
            confirm = correlation.getFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpException("Interrupted while waiting for publisher confirm " + correlation.getId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AmqpException("Publisher confirm not received for " + correlation.getId(), e);
        }
        checkAck(correlation, confirm);
    }

    private void checkAck(CorrelationData correlation, CorrelationData.Confirm confirm) {
        if (!confirm.isAck()) {
            throw new AmqpException("Broker rejected publish " + correlation.getId() + ": " + confirm.getReason());
        }
    }

    /** Circuit breaker açıkken tek event için 503 + Retry-After. */
    @SuppressWarnings("unused")
    private void handlePublishFailure(NotificationEvent event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for RabbitMQ producer. Rejecting event {}", event.getId());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. RabbitMQ circuit breaker is open.", 30);
    }

    /** Tek event için tüm retry'lar tükendikten sonra fallback. */
    @SuppressWarnings("unused")
    private void handlePublishFailure(NotificationEvent event, Exception ex) {
        log.error("RabbitMQ publish failed after all retries for event {}: {}", event.getId(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    @SuppressWarnings("unused")
    private void handleBatchPublishFailure(List<NotificationEvent> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for RabbitMQ producer. Rejecting batch of {} events", events.size());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. RabbitMQ circuit breaker is open.", 30);
    }

    @SuppressWarnings("unused")
    private void handleBatchPublishFailure(List<NotificationEvent> events, Exception ex) {
        log.error("RabbitMQ batch publish failed for {} events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    /** Circuit breaker açık veya RabbitMQ yok; GlobalExceptionHandler 503 + Retry-After döner. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}

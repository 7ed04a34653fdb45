package com.baykanat.notifier.infrastructure.amqp;

import com.baykanat.notifier.config.AppProperties;
import com.baykanat.notifier.domain.model.ProcessingOutcome;
import com.baykanat.notifier.domain.service.NotificationProcessingService;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** Ana kuyruğu tüketir; her çağrıda tek mesaj, son aksiyon her zaman ack veya nack. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.consumer.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationEventConsumer {

    static final String LISTENER_ID = "notificationEventConsumer";

    private final NotificationProcessingService processingService;
    private final AppProperties appProperties;

    /**
     * Her sonuçta ack. Ledger'ın kalıcı olarak reddettiği mesaj (constraint ihlali vb.) ack ile düşürülür;
     * geçici DB/broker hatasında kısa bekleme sonrası requeue ile nack.
     */
    @RabbitListener(
            id = LISTENER_ID,
            queues = "${app.rabbit.main-queue}",
            containerFactory = "rabbitListenerContainerFactory"
    )
    public void consume(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        ProcessingOutcome outcome;
        try {
            outcome = processingService.process(message.getBody());
        } catch (NonTransientDataAccessException e) {
            // Tekrar denense de aynı hata; requeue kuyruğun başını kilitler
            log.error("Ledger rejected delivery {} permanently, dropping: {}", deliveryTag, e.getMessage(), e);
            channel.basicAck(deliveryTag, false);
            return;
        } catch (RuntimeException e) {
            log.error("Bookkeeping failed for delivery {}, requeueing: {}", deliveryTag, e.getMessage(), e);
            pauseBeforeRequeue();
            channel.basicNack(deliveryTag, false, true);
            return;
        }

        channel.basicAck(deliveryTag, false);
        log.debug("Delivery {} acknowledged with outcome {}", deliveryTag, outcome);
    }

    /** Kesinti sırasında requeue edilen mesajın anında geri gelip log'u doldurmaması için. */
    private void pauseBeforeRequeue() {
        long delayMs = appProperties.getRabbit().getRequeueDelay().toMillis();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to requeue; nacking immediately");
        }
    }
}

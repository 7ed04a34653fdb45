package com.baykanat.notifier.infrastructure.delivery;

import com.baykanat.notifier.config.AppProperties;
import com.baykanat.notifier.domain.model.NotificationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** E-posta sağlayıcı yerine simülasyon: sabit gecikme, failure marker içeren alıcıda hata. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedNotificationSender implements NotificationSender {

    private final AppProperties appProperties;

    @Override
    public void send(NotificationPayload notification) {
        simulateLatency();

        String recipient = notification.getRecipient();
        if (recipient == null || recipient.isBlank()) {
            throw new NotificationDeliveryException(
                    "Notification " + notification.getNotificationId() + " has no recipient");
        }

        String marker = appProperties.getDelivery().getFailureMarker();
        if (marker != null && !marker.isEmpty() && recipient.contains(marker)) {
            throw new NotificationDeliveryException(
                    "Simulated external service failure (network timeout) for " + recipient);
        }

        log.info("Notification {} sent to {}: {}",
                notification.getNotificationId(), recipient, notification.getMessage());
    }

    private void simulateLatency() {
        long latencyMs = appProperties.getDelivery().getSimulatedLatency().toMillis();
        if (latencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Interrupted during simulated delivery", e);
        }
    }
}

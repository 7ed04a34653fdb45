package com.baykanat.notifier.infrastructure.delivery;

/** Gönderim denemesi başarısız; retry hakkı bitene kadar tier ile tekrar, sonra DLQ. */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

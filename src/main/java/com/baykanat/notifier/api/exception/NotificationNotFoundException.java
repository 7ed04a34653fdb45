package com.baykanat.notifier.api.exception;

/** Event id için henüz ledger kaydı yok; GlobalExceptionHandler 404 döner. */
public class NotificationNotFoundException extends RuntimeException {

    public NotificationNotFoundException(String eventId) {
        super("No notification recorded for event " + eventId);
    }
}

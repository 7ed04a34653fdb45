package com.baykanat.notifier.domain.model;

/** Bildirimin ledger durumu; SENT ve FAILED_DLQ terminal. */
public enum NotificationStatus {
    QUEUED,
    SENT,
    FAILED_RETRYING,
    FAILED_DLQ;

    /** Terminal durumda aynı event id'nin sonraki tüm redelivery'leri atlanır. */
    public boolean isTerminal() {
        return this == SENT || this == FAILED_DLQ;
    }
}

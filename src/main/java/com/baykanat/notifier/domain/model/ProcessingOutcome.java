package com.baykanat.notifier.domain.model;

/** Tüketilen tek mesajın son geçişi; her sonuçta ack. */
public enum ProcessingOutcome {
    SENT,
    SKIPPED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    DROPPED_MALFORMED
}

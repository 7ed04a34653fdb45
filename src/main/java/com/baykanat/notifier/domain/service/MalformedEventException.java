package com.baykanat.notifier.domain.service;

/** Mesaj gövdesi event'e dönüştürülemiyor; redelivery bunu düzeltmez. */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}

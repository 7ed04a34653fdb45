package com.baykanat.notifier.infrastructure.amqp;

/** Kuyruk veya exchange farklı argümanlarla zaten var; açılış devam etmemeli. */
public class TopologyMismatchException extends RuntimeException {

    public TopologyMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

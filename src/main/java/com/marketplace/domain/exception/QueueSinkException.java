package com.marketplace.domain.exception;

/**
 * The requeue or dead-letter sink could not accept an envelope. Callers must treat
 * this as an infrastructure failure; the delivery outcome is unknown.
 */
public class QueueSinkException extends QueueRuntimeException {

    public QueueSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

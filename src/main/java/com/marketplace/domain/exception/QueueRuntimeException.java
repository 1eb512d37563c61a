package com.marketplace.domain.exception;

/**
 * Base type for failures the consumer runtime raises instead of returning an outcome.
 */
public class QueueRuntimeException extends RuntimeException {

    public QueueRuntimeException(String message) {
        super(message);
    }

    public QueueRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}

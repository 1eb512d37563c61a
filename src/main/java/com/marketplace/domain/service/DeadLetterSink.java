package com.marketplace.domain.service;

import com.marketplace.domain.model.QueueEnvelope;

/**
 * Accepts an envelope whose retry budget is exhausted.
 */
@FunctionalInterface
public interface DeadLetterSink<T> {

    void publishToDlq(QueueEnvelope<T> envelope) throws Exception;
}

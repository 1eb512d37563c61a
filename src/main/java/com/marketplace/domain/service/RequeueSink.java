package com.marketplace.domain.service;

import com.marketplace.domain.model.QueueEnvelope;

/**
 * Accepts an envelope for redelivery after {@code delaySeconds}. The sink owns the
 * actual scheduling, typically a broker's delayed-delivery feature.
 */
@FunctionalInterface
public interface RequeueSink<T> {

    void requeue(QueueEnvelope<T> envelope, long delaySeconds) throws Exception;
}

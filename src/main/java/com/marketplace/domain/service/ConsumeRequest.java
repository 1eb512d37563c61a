package com.marketplace.domain.service;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One delivery handed to {@link QueueConsumerRunner}.
 *
 * {@code payload} is the raw body as received (map, JSON tree, JSON string or object);
 * the runner binds it to {@code payloadType}, which must be the topic's contract type.
 * {@code attempt} is threaded across redeliveries by the transport.
 */
@Value
@Builder
public class ConsumeRequest<T> {

    @NonNull
    String topicKey;

    Object payload;

    @NonNull
    Class<T> payloadType;

    String idempotencyKey;

    String traceId;

    @Builder.Default
    int attempt = 0;

    @NonNull
    QueueHandler<T> handler;

    @NonNull
    DeadLetterSink<T> publishToDlq;

    @NonNull
    RequeueSink<T> requeue;
}

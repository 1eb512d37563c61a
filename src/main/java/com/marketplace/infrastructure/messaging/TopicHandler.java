package com.marketplace.infrastructure.messaging;

import com.marketplace.domain.service.QueueHandler;

/**
 * Business handler bound to one queue topic. Beans of this type are picked up by
 * {@link TopicHandlerRegistry} and fed by {@link QueueEnvelopeListener}.
 */
public interface TopicHandler<T> extends QueueHandler<T> {

    String topicKey();

    Class<T> payloadType();
}

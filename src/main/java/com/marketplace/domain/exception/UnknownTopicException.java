package com.marketplace.domain.exception;

import lombok.Getter;

/**
 * A topic key that is not in the registry. This is a configuration error.
 */
@Getter
public class UnknownTopicException extends QueueRuntimeException {

    private final String topicKey;

    public UnknownTopicException(String topicKey) {
        super("Unknown queue topic: " + topicKey);
        this.topicKey = topicKey;
    }
}

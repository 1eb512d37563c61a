package com.marketplace.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies one class of event: its internal key, the wire topic it travels on,
 * the payload contract it must satisfy and its retry policy.
 */
@Value
@Builder
public class TopicContract {

    String topicKey;
    String wireTopic;
    String purpose;
    PayloadContract payloadContract;
    RetryPolicy policy;
}

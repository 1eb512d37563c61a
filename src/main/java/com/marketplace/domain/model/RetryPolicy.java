package com.marketplace.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed-delay retry policy attached to a topic.
 *
 * maxRetries is the number of re-deliveries permitted before a message is
 * dead-lettered; backoffSeconds is the same for every attempt.
 */
@Value
@Builder
public class RetryPolicy {

    int maxRetries;
    long backoffSeconds;
    String deadLetterTopic;

    /**
     * True when a failed delivery at {@code nextAttempt} has used up the retry budget.
     */
    public boolean isExhausted(int nextAttempt) {
        return nextAttempt > maxRetries;
    }
}

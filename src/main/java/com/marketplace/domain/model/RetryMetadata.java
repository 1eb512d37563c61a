package com.marketplace.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Retry bookkeeping carried by every envelope.
 *
 * nextRetryAt is only set on requeued envelopes; failedAt and lastError only on
 * dead-lettered ones.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetryMetadata {

    int attempt;
    int maxRetries;
    long backoffSeconds;
    Instant nextRetryAt;
    Instant failedAt;
    String lastError;
}

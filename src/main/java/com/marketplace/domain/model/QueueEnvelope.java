package com.marketplace.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Unit of data handed to the requeue and dead-letter sinks.
 *
 * A new envelope is built for every retry or dead-letter decision; envelopes are
 * never modified after construction.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueEnvelope<T> {

    String topic;
    T payload;
    String idempotencyKey;
    String traceId;
    EnvelopeMetadata metadata;

    @JsonIgnore
    public int getAttempt() {
        return metadata.getRetry().getAttempt();
    }
}

package com.marketplace.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result returned to the caller of the consumer runner.
 *
 * retries is the attempt count reached; nextRetryAt is set for RETRY only and
 * error for RETRY, DLQ and IDEMPOTENCY_CONFLICT.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsumeOutcome {

    ConsumeStatus status;
    int retries;
    Instant nextRetryAt;
    String error;

    public static ConsumeOutcome processed(int attempt) {
        return ConsumeOutcome.builder().status(ConsumeStatus.PROCESSED).retries(attempt).build();
    }

    public static ConsumeOutcome duplicate(int attempt) {
        return ConsumeOutcome.builder().status(ConsumeStatus.DUPLICATE).retries(attempt).build();
    }

    public static ConsumeOutcome conflict(int attempt, String message) {
        return ConsumeOutcome.builder()
                .status(ConsumeStatus.IDEMPOTENCY_CONFLICT)
                .retries(attempt)
                .error(message)
                .build();
    }

    public static ConsumeOutcome retry(int nextAttempt, Instant nextRetryAt, String error) {
        return ConsumeOutcome.builder()
                .status(ConsumeStatus.RETRY)
                .retries(nextAttempt)
                .nextRetryAt(nextRetryAt)
                .error(error)
                .build();
    }

    public static ConsumeOutcome deadLettered(int nextAttempt, String error) {
        return ConsumeOutcome.builder()
                .status(ConsumeStatus.DLQ)
                .retries(nextAttempt)
                .error(error)
                .build();
    }
}

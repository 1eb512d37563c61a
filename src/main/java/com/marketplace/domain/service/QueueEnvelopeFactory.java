package com.marketplace.domain.service;

import com.marketplace.domain.model.EnvelopeMetadata;
import com.marketplace.domain.model.QueueEnvelope;
import com.marketplace.domain.model.RetryMetadata;
import com.marketplace.domain.model.RetryPolicy;
import com.marketplace.domain.model.TopicContract;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Wraps payloads with topic metadata and retry bookkeeping.
 *
 * No I/O and no retained state; the only input besides the arguments is the clock.
 */
@Component
@RequiredArgsConstructor
public class QueueEnvelopeFactory {

    private final TopicContractRegistry topicRegistry;
    private final Clock clock;

    public <T> QueueEnvelope<T> build(String topicKey, T payload, int attempt,
                                      String idempotencyKey, String traceId) {
        TopicContract topic = topicRegistry.get(topicKey);
        return envelope(topic, payload, idempotencyKey, traceId, retryMetadata(topic.getPolicy(), attempt).build());
    }

    /**
     * Envelope for a redelivery, stamped with when it is due.
     */
    public <T> QueueEnvelope<T> forRetry(String topicKey, T payload, int attempt,
                                         String idempotencyKey, String traceId) {
        TopicContract topic = topicRegistry.get(topicKey);
        RetryPolicy policy = topic.getPolicy();
        RetryMetadata retry = retryMetadata(policy, attempt)
                .nextRetryAt(nextRetryAt(policy))
                .build();
        return envelope(topic, payload, idempotencyKey, traceId, retry);
    }

    /**
     * Envelope for the dead-letter topic, stamped with the failure time and last error.
     */
    public <T> QueueEnvelope<T> forDeadLetter(String topicKey, T payload, int attempt,
                                              String idempotencyKey, String traceId, String lastError) {
        TopicContract topic = topicRegistry.get(topicKey);
        RetryMetadata retry = retryMetadata(topic.getPolicy(), attempt)
                .failedAt(clock.instant())
                .lastError(lastError)
                .build();
        return envelope(topic, payload, idempotencyKey, traceId, retry);
    }

    public Instant nextRetryAt(RetryPolicy policy) {
        return clock.instant().plusSeconds(policy.getBackoffSeconds());
    }

    private static RetryMetadata.RetryMetadataBuilder retryMetadata(RetryPolicy policy, int attempt) {
        return RetryMetadata.builder()
                .attempt(attempt)
                .maxRetries(policy.getMaxRetries())
                .backoffSeconds(policy.getBackoffSeconds());
    }

    private <T> QueueEnvelope<T> envelope(TopicContract topic, T payload, String idempotencyKey,
                                          String traceId, RetryMetadata retry) {
        return QueueEnvelope.<T>builder()
                .topic(topic.getWireTopic())
                .payload(payload)
                .idempotencyKey(idempotencyKey)
                .traceId(traceId)
                .metadata(EnvelopeMetadata.builder()
                        .retry(retry)
                        .publishedAt(clock.instant())
                        .deadLetterTopic(topic.getPolicy().getDeadLetterTopic())
                        .build())
                .build();
    }
}

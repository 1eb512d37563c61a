package com.marketplace.domain.service;

import com.marketplace.domain.exception.ContractViolationException;
import com.marketplace.domain.exception.QueueSinkException;
import com.marketplace.domain.model.ConsumeOutcome;
import com.marketplace.domain.model.ConsumeStatus;
import com.marketplace.domain.model.IdempotencyCheck;
import com.marketplace.domain.model.QueueEnvelope;
import com.marketplace.domain.model.RetryPolicy;
import com.marketplace.domain.model.TopicContract;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Queue consumer runner with bounded retry and dead-letter routing.
 *
 * Processing Flow:
 * 1. Validate the payload against the topic contract
 * 2. Check idempotency (duplicate and key-reuse detection)
 * 3. Invoke the handler
 * 4. Classify the outcome: processed, or requeue / dead-letter on failure
 *
 * Failure Handling:
 * - Contract violation: thrown to the caller, never retried, never dead-lettered
 * - Idempotency conflict: returned as IDEMPOTENCY_CONFLICT, handler not invoked
 * - Handler failure within budget: idempotency key released, fresh envelope handed
 *   to the requeue sink
 * - Handler failure past maxRetries: envelope handed to the dead-letter sink, key kept
 * - Sink failure: thrown as QueueSinkException
 *
 * The runner keeps no state between calls. The attempt counter travels with the
 * message; cross-call state otherwise lives in the idempotency store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueConsumerRunner {

    private final TopicContractRegistry topicRegistry;
    private final PayloadContractValidator contractValidator;
    private final IdempotencyService idempotencyService;
    private final QueueEnvelopeFactory envelopeFactory;
    private final MeterRegistry meterRegistry;

    public <T> ConsumeOutcome run(ConsumeRequest<T> request) {
        String topicKey = request.getTopicKey();
        int attempt = request.getAttempt();
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }

        TopicContract topic = topicRegistry.get(topicKey);

        // Step 1: Validate contract
        T payload;
        try {
            payload = contractValidator.validate(topicKey, request.getPayload(), request.getPayloadType());
        } catch (ContractViolationException e) {
            log.debug("Contract violation on {}: {}", topicKey, e.getViolations());
            Counter.builder("queue.consumer.contract_violation")
                    .tag("topic", topicKey)
                    .register(meterRegistry)
                    .increment();
            throw e;
        }

        // Step 2: Check idempotency
        IdempotencyCheck check = idempotencyService.checkAndStore(topicKey, request.getIdempotencyKey(), payload);

        if (check.isDuplicate() && !check.isConflict()) {
            log.info("Duplicate delivery on {} suppressed: key={}", topicKey, request.getIdempotencyKey());
            return record(topicKey, ConsumeOutcome.duplicate(attempt));
        }
        if (check.isConflict()) {
            return record(topicKey, ConsumeOutcome.conflict(attempt, check.getMessage()));
        }

        // Step 3: Invoke handler
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            request.getHandler().handle(payload);

            log.debug("Message processed on {} at attempt {}", topicKey, attempt);
            return record(topicKey, ConsumeOutcome.processed(attempt));

        } catch (Exception e) {
            restoreInterrupt(e);
            return handleFailure(topic, request, check, attempt, errorMessage(e));

        } finally {
            sample.stop(Timer.builder("queue.consumer.handler.latency")
                    .tag("topic", topicKey)
                    .register(meterRegistry));
        }
    }

    private <T> ConsumeOutcome handleFailure(TopicContract topic, ConsumeRequest<T> request, IdempotencyCheck claim,
                                             int attempt, String error) {
        String topicKey = topic.getTopicKey();
        RetryPolicy policy = topic.getPolicy();
        int nextAttempt = attempt + 1;

        // the handler may have modified its copy; envelopes carry the payload as delivered
        T payload = contractValidator.validate(topicKey, request.getPayload(), request.getPayloadType());

        if (policy.isExhausted(nextAttempt)) {
            QueueEnvelope<T> envelope = envelopeFactory.forDeadLetter(topicKey, payload, nextAttempt,
                    request.getIdempotencyKey(), request.getTraceId(), error);
            try {
                request.getPublishToDlq().publishToDlq(envelope);
            } catch (Exception e) {
                restoreInterrupt(e);
                idempotencyService.release(topicKey, request.getIdempotencyKey(), claim);
                log.error("Failed to dead-letter message on {} to {}: {}",
                        topicKey, policy.getDeadLetterTopic(), e.getMessage(), e);
                throw new QueueSinkException("Dead-letter publish failed for topic " + topicKey, e);
            }

            log.warn("Retries exhausted on {} after {} attempts, dead-lettered to {}: {}",
                    topicKey, nextAttempt, policy.getDeadLetterTopic(), error);
            return record(topicKey, ConsumeOutcome.deadLettered(nextAttempt, error));
        }

        // only a requeued delivery gives its key back; a dead-lettered one keeps it
        idempotencyService.release(topicKey, request.getIdempotencyKey(), claim);

        QueueEnvelope<T> envelope = envelopeFactory.forRetry(topicKey, payload, nextAttempt,
                request.getIdempotencyKey(), request.getTraceId());
        try {
            request.getRequeue().requeue(envelope, policy.getBackoffSeconds());
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to requeue message on {}: {}", topicKey, e.getMessage(), e);
            throw new QueueSinkException("Requeue failed for topic " + topicKey, e);
        }

        log.warn("Handler failed on {} (attempt {} of {}), retrying in {}s: {}",
                topicKey, nextAttempt, policy.getMaxRetries(), policy.getBackoffSeconds(), error);
        return record(topicKey, ConsumeOutcome.retry(nextAttempt,
                envelope.getMetadata().getRetry().getNextRetryAt(), error));
    }

    private ConsumeOutcome record(String topicKey, ConsumeOutcome outcome) {
        Counter.builder("queue.consumer.outcome")
                .tag("topic", topicKey)
                .tag("status", outcome.getStatus().getWireName())
                .register(meterRegistry)
                .increment();

        if (outcome.getStatus() == ConsumeStatus.IDEMPOTENCY_CONFLICT) {
            log.warn("Idempotency conflict on {}: {}", topicKey, outcome.getError());
        }
        return outcome;
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}

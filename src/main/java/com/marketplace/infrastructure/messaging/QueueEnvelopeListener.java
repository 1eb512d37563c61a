package com.marketplace.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.domain.exception.ContractViolationException;
import com.marketplace.domain.model.ConsumeOutcome;
import com.marketplace.domain.model.TopicContract;
import com.marketplace.domain.service.ConsumeRequest;
import com.marketplace.domain.service.QueueConsumerRunner;
import com.marketplace.domain.service.TopicContractRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Kafka consumer feeding queue envelopes to the consumer runner.
 *
 * Architecture:
 * - Manual acknowledgment: the offset moves on only once the runner returned an outcome
 * - Envelopes requeued with a future x-not-before header are deferred with nack
 * - Retries and dead letters go back through {@link KafkaQueueSinks}
 * - Contract violations and unreadable records are logged and skipped; they would fail
 *   the same way on every redelivery
 * - Infrastructure failures (idempotency store, sinks) are nacked for redelivery
 *
 * Messages are either envelopes ({@code payload} + {@code metadata}) or bare payloads,
 * which start at attempt 0 and take their idempotency key from the
 * {@code x-idempotency-key} header.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.queue.listener", name = "enabled", havingValue = "true")
public class QueueEnvelopeListener {

    static final String IDEMPOTENCY_KEY_HEADER = "x-idempotency-key";
    static final String TRACE_ID_HEADER = "x-trace-id";

    private static final Duration MAX_DEFERRAL = Duration.ofSeconds(30);
    private static final Duration REDELIVERY_PAUSE = Duration.ofSeconds(1);

    private final TopicContractRegistry topicRegistry;
    private final TopicHandlerRegistry handlerRegistry;
    private final QueueConsumerRunner consumerRunner;
    private final KafkaQueueSinks sinks;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public QueueEnvelopeListener(TopicContractRegistry topicRegistry,
                                 TopicHandlerRegistry handlerRegistry,
                                 QueueConsumerRunner consumerRunner,
                                 KafkaQueueSinks sinks,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.topicRegistry = topicRegistry;
        this.handlerRegistry = handlerRegistry;
        this.consumerRunner = consumerRunner;
        this.sinks = sinks;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @KafkaListener(
            topics = "#{@topicHandlerRegistry.wireTopics()}",
            groupId = "${app.queue.listener.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        Optional<TopicContract> topic = topicRegistry.findByWireTopic(record.topic());
        if (topic.isEmpty()) {
            log.error("Record on unregistered topic {} skipped: partition={}, offset={}",
                    record.topic(), record.partition(), record.offset());
            count("unknown_topic");
            acknowledgment.acknowledge();
            return;
        }

        if (record.value() == null) {
            log.error("Empty record on {} skipped: offset={}", record.topic(), record.offset());
            count("contract_violation");
            acknowledgment.acknowledge();
            return;
        }

        Instant notBefore = notBefore(record);
        Instant now = clock.instant();
        if (notBefore != null && notBefore.isAfter(now)) {
            Duration wait = Duration.between(now, notBefore);
            log.debug("Deferring record on {} for {} ms", record.topic(), wait.toMillis());
            acknowledgment.nack(wait.compareTo(MAX_DEFERRAL) > 0 ? MAX_DEFERRAL : wait);
            return;
        }

        String topicKey = topic.get().getTopicKey();
        TopicHandler<?> handler = handlerRegistry.find(topicKey).orElse(null);
        if (handler == null) {
            log.error("No handler for topic {}, record skipped: offset={}", topicKey, record.offset());
            count("no_handler");
            acknowledgment.acknowledge();
            return;
        }

        try {
            JsonNode root = objectMapper.readTree(record.value());
            ConsumeOutcome outcome = dispatch(topicKey, handler, root, record);

            log.debug("Record on {} finished with {} (retries={})",
                    record.topic(), outcome.getStatus().getWireName(), outcome.getRetries());
            count(outcome.getStatus().getWireName());
            acknowledgment.acknowledge();

        } catch (JsonProcessingException | ContractViolationException e) {
            log.error("Rejected malformed record on {} at offset {}: {}",
                    record.topic(), record.offset(), e.getMessage());
            count("contract_violation");
            acknowledgment.acknowledge();

        } catch (RuntimeException e) {
            log.error("Infrastructure failure consuming {} at offset {}, will redeliver: {}",
                    record.topic(), record.offset(), e.getMessage(), e);
            count("error");
            acknowledgment.nack(REDELIVERY_PAUSE);
        }
    }

    private <T> ConsumeOutcome dispatch(String topicKey, TopicHandler<T> handler, JsonNode root,
                                        ConsumerRecord<String, String> record) {
        boolean envelope = root.isObject() && root.has("payload") && root.has("metadata");

        ConsumeRequest.ConsumeRequestBuilder<T> request = ConsumeRequest.<T>builder()
                .topicKey(topicKey)
                .payloadType(handler.payloadType())
                .handler(handler)
                .requeue(sinks.requeue())
                .publishToDlq(sinks.deadLetter());

        if (envelope) {
            int attempt = root.path("metadata").path("retry").path("attempt").asInt(0);
            if (attempt < 0) {
                throw new ContractViolationException(
                        topicRegistry.get(topicKey).getPayloadContract().getKey(),
                        List.of("metadata.retry.attempt: must not be negative"));
            }
            request.payload(root.get("payload"))
                    .idempotencyKey(text(root, "idempotency_key"))
                    .traceId(text(root, "trace_id"))
                    .attempt(attempt);
        } else {
            request.payload(root)
                    .idempotencyKey(headerValue(record, IDEMPOTENCY_KEY_HEADER).orElse(null))
                    .traceId(headerValue(record, TRACE_ID_HEADER).orElse(null));
        }
        return consumerRunner.run(request.build());
    }

    private void count(String result) {
        Counter.builder("kafka.queue.records.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static Instant notBefore(ConsumerRecord<String, String> record) {
        Optional<String> value = headerValue(record, KafkaQueueSinks.NOT_BEFORE_HEADER);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.get()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header on {}: {}",
                    KafkaQueueSinks.NOT_BEFORE_HEADER, record.topic(), value.get());
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Optional<String> headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? Optional.empty()
                : Optional.of(new String(header.value(), StandardCharsets.UTF_8));
    }
}

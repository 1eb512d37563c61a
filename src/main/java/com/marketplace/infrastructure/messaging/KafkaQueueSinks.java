package com.marketplace.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.config.QueueRuntimeProperties;
import com.marketplace.domain.model.QueueEnvelope;
import com.marketplace.domain.service.DeadLetterSink;
import com.marketplace.domain.service.RequeueSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Kafka-backed requeue and dead-letter sinks.
 *
 * Envelopes are sent as JSON. Kafka has no delayed delivery, so a requeued envelope
 * carries an {@code x-not-before} header and the listener defers it until then.
 * Sends are awaited so a broker failure reaches the runner as a sink failure.
 */
@Slf4j
@Component
public class KafkaQueueSinks {

    public static final String ATTEMPT_HEADER = "x-attempt";
    public static final String NOT_BEFORE_HEADER = "x-not-before";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration sendTimeout;

    public KafkaQueueSinks(KafkaTemplate<String, String> kafkaTemplate,
                           ObjectMapper objectMapper,
                           Clock clock,
                           QueueRuntimeProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sendTimeout = properties.getKafka().getSendTimeout();
    }

    public <T> RequeueSink<T> requeue() {
        return (envelope, delaySeconds) ->
                send(envelope.getTopic(), envelope, clock.instant().plusSeconds(delaySeconds));
    }

    public <T> DeadLetterSink<T> deadLetter() {
        return envelope -> send(envelope.getMetadata().getDeadLetterTopic(), envelope, null);
    }

    private void send(String topic, QueueEnvelope<?> envelope, Instant notBefore) throws Exception {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                topic, envelope.getIdempotencyKey(), objectMapper.writeValueAsString(envelope));

        record.headers().add(ATTEMPT_HEADER,
                String.valueOf(envelope.getAttempt()).getBytes(StandardCharsets.UTF_8));
        if (notBefore != null) {
            record.headers().add(NOT_BEFORE_HEADER,
                    String.valueOf(notBefore.toEpochMilli()).getBytes(StandardCharsets.UTF_8));
        }

        kafkaTemplate.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Published envelope to {} (attempt {})", topic, envelope.getAttempt());
    }
}

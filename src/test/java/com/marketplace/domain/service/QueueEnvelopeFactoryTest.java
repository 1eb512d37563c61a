package com.marketplace.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketplace.domain.exception.UnknownTopicException;
import com.marketplace.domain.model.QueueEnvelope;
import com.marketplace.domain.model.RetryMetadata;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueEnvelopeFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-10T08:30:00Z");

    private final QueueEnvelopeFactory factory = new QueueEnvelopeFactory(
            TopicContractRegistry.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void build_populatesTopicAndRetryMetadata() {
        QueueEnvelope<Map<String, Object>> envelope = factory.build(
                "inventory_sync", Map.of("delta", 2), 3, "idem-1", "trace-1");

        assertEquals("inventory.sync.v1", envelope.getTopic());
        assertEquals(Map.of("delta", 2), envelope.getPayload());
        assertEquals("idem-1", envelope.getIdempotencyKey());
        assertEquals("trace-1", envelope.getTraceId());
        assertEquals(NOW, envelope.getMetadata().getPublishedAt());
        assertEquals("inventory.sync.dlq.v1", envelope.getMetadata().getDeadLetterTopic());

        RetryMetadata retry = envelope.getMetadata().getRetry();
        assertEquals(3, retry.getAttempt());
        assertEquals(8, retry.getMaxRetries());
        assertEquals(15, retry.getBackoffSeconds());
        assertNull(retry.getNextRetryAt());
        assertNull(retry.getFailedAt());
        assertNull(retry.getLastError());
        assertEquals(3, envelope.getAttempt());
    }

    @Test
    void forRetry_stampsNextRetryAt() {
        QueueEnvelope<String> envelope = factory.forRetry("payments_settlement", "p", 1, null, null);

        assertEquals(NOW.plusSeconds(30), envelope.getMetadata().getRetry().getNextRetryAt());
        assertNull(envelope.getMetadata().getRetry().getFailedAt());
    }

    @Test
    void forDeadLetter_stampsFailureDetails() {
        QueueEnvelope<String> envelope = factory.forDeadLetter("invoice_issuance", "p", 7, "k", "t", "boom");

        RetryMetadata retry = envelope.getMetadata().getRetry();
        assertEquals(7, retry.getAttempt());
        assertEquals(NOW, retry.getFailedAt());
        assertEquals("boom", retry.getLastError());
        assertNull(retry.getNextRetryAt());
        assertEquals("invoice.issuance.v1", envelope.getTopic());
        assertEquals("invoice.issuance.dlq.v1", envelope.getMetadata().getDeadLetterTopic());
    }

    @Test
    void build_unknownTopicThrows() {
        assertThrows(UnknownTopicException.class, () -> factory.build("nope", "p", 0, null, null));
    }

    @Test
    void serializedEnvelope_usesWireFieldNames() throws Exception {
        JsonMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();

        JsonNode json = mapper.valueToTree(factory.forRetry("inventory_sync", Map.of("delta", 2), 1, "idem-1", null));

        assertEquals("inventory.sync.v1", json.get("topic").asText());
        assertEquals("idem-1", json.get("idempotency_key").asText());
        assertFalse(json.has("trace_id"));
        assertFalse(json.has("attempt"));
        assertEquals("2024-05-10T08:30:00Z", json.at("/metadata/published_at").asText());
        assertEquals("inventory.sync.dlq.v1", json.at("/metadata/dead_letter_topic").asText());
        assertEquals(1, json.at("/metadata/retry/attempt").asInt());
        assertEquals(8, json.at("/metadata/retry/maxRetries").asInt());
        assertEquals(15, json.at("/metadata/retry/backoffSeconds").asInt());
        assertEquals("2024-05-10T08:30:15Z", json.at("/metadata/retry/nextRetryAt").asText());
        assertFalse(json.at("/metadata/retry").has("failedAt"));
    }
}

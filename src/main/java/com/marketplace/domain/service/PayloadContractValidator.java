package com.marketplace.domain.service;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.datatype.jsr310.deser.InstantDeserializer;
import com.marketplace.domain.exception.ContractViolationException;
import com.marketplace.domain.model.PayloadContract;
import com.marketplace.domain.model.TopicContract;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural validation of inbound payloads against their topic contract.
 *
 * Binding is strict: unknown fields, scalar coercion ("1" for an integer, 1 or true
 * for a string), fractional numbers for integer fields, enum ordinals and epoch
 * timestamps are all rejected. The bound object is then
 * checked with Bean Validation for required fields, closed value sets and ranges.
 *
 * Validation runs before any idempotency bookkeeping, so a malformed payload never
 * claims an idempotency slot and never reaches a handler.
 */
@Slf4j
@Service
public class PayloadContractValidator {

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private final TopicContractRegistry topicRegistry;
    private final Validator validator;
    private final ObjectMapper strictMapper;

    public PayloadContractValidator(TopicContractRegistry topicRegistry, Validator validator) {
        this.topicRegistry = topicRegistry;
        this.validator = validator;
        this.strictMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new SimpleModule("strict-instant")
                        .addDeserializer(Instant.class, new IsoInstantDeserializer()))
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .withCoercionConfig(LogicalType.Textual, config -> config
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .withCoercionConfig(LogicalType.Enum, config -> config
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail))
                .build();
    }

    /**
     * Validate a payload for a topic and bind it to the topic's contract type.
     *
     * @throws com.marketplace.domain.exception.UnknownTopicException if the topic is not registered
     * @throws IllegalArgumentException if {@code payloadType} is not the topic's contract type
     * @throws ContractViolationException if the payload does not satisfy the contract
     */
    public <T> T validate(String topicKey, Object rawPayload, Class<T> payloadType) {
        TopicContract topic = topicRegistry.get(topicKey);
        PayloadContract contract = topic.getPayloadContract();

        if (!contract.getPayloadType().equals(payloadType)) {
            throw new IllegalArgumentException("Topic " + topicKey + " carries "
                    + contract.getPayloadType().getSimpleName() + ", not " + payloadType.getSimpleName());
        }
        return bind(contract, rawPayload, payloadType);
    }

    /**
     * Validate a payload against a contract directly, whether or not a topic uses it.
     */
    public Object validate(PayloadContract contract, Object rawPayload) {
        return bind(contract, rawPayload, contract.getPayloadType());
    }

    private <T> T bind(PayloadContract contract, Object rawPayload, Class<T> payloadType) {
        if (rawPayload == null) {
            throw new ContractViolationException(contract.getKey(), List.of("payload: is required"));
        }

        T bound;
        try {
            bound = strictMapper.treeToValue(toTree(contract, rawPayload), payloadType);
        } catch (UnrecognizedPropertyException e) {
            throw new ContractViolationException(contract.getKey(),
                    List.of(describePath(e.getPath()) + ": is not an allowed field"), e);
        } catch (JsonMappingException e) {
            throw new ContractViolationException(contract.getKey(),
                    List.of(describePath(e.getPath()) + ": " + e.getOriginalMessage()), e);
        } catch (JsonProcessingException e) {
            throw new ContractViolationException(contract.getKey(),
                    List.of("payload: is not valid JSON"), e);
        }

        if (bound == null) {
            throw new ContractViolationException(contract.getKey(), List.of("payload: is required"));
        }

        List<String> violations = validator.validate(bound).stream()
                .map(PayloadContractValidator::describe)
                .sorted()
                .collect(Collectors.toList());

        if (!violations.isEmpty()) {
            log.debug("Payload rejected by contract {}: {}", contract.getKey(), violations);
            throw new ContractViolationException(contract.getKey(), violations);
        }
        return bound;
    }

    private JsonNode toTree(PayloadContract contract, Object rawPayload) throws JsonProcessingException {
        if (rawPayload instanceof JsonNode) {
            return (JsonNode) rawPayload;
        }
        if (rawPayload instanceof String) {
            return strictMapper.readTree((String) rawPayload);
        }
        try {
            return strictMapper.valueToTree(rawPayload);
        } catch (IllegalArgumentException e) {
            throw new ContractViolationException(contract.getKey(), List.of("payload: cannot be read as JSON"), e);
        }
    }

    private static String describe(ConstraintViolation<?> violation) {
        return SNAKE_CASE.translate(violation.getPropertyPath().toString()) + ": " + violation.getMessage();
    }

    private static String describePath(List<JsonMappingException.Reference> path) {
        if (path == null || path.isEmpty()) {
            return "payload";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference reference : path) {
            if (reference.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                sb.append('[').append(reference.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? "payload" : sb.toString();
    }

    /**
     * ISO-8601 strings only; epoch numbers are rejected.
     */
    private static final class IsoInstantDeserializer extends StdScalarDeserializer<Instant> {

        IsoInstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
            }
            return InstantDeserializer.INSTANT.deserialize(p, ctxt);
        }
    }
}

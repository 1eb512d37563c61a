package com.marketplace.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.domain.model.PayloadContract;
import com.marketplace.domain.model.RetryPolicy;
import com.marketplace.domain.model.TopicContract;
import com.marketplace.domain.service.TopicContractRegistry;
import com.marketplace.infrastructure.persistence.repository.FallbackIdempotencyRecordRepository;
import com.marketplace.infrastructure.persistence.repository.IdempotencyRecordRepository;
import com.marketplace.infrastructure.persistence.repository.InMemoryIdempotencyRecordRepository;
import com.marketplace.infrastructure.persistence.repository.RedisIdempotencyRecordRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class QueueRuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Topic table, fixed for the life of the process.
     */
    @Bean
    public TopicContractRegistry topicContractRegistry(QueueRuntimeProperties properties) {
        if (properties.getTopics().isEmpty()) {
            log.info("No queue topics configured, using built-in marketplace topics");
            return TopicContractRegistry.defaults();
        }

        List<TopicContract> contracts = properties.getTopics().entrySet().stream()
                .map(entry -> TopicContract.builder()
                        .topicKey(entry.getKey())
                        .wireTopic(entry.getValue().getWireTopic())
                        .purpose(entry.getValue().getPurpose())
                        .payloadContract(PayloadContract.fromKey(entry.getValue().getContract()))
                        .policy(RetryPolicy.builder()
                                .maxRetries(entry.getValue().getMaxRetries())
                                .backoffSeconds(entry.getValue().getBackoffSeconds())
                                .deadLetterTopic(entry.getValue().getDeadLetterTopic())
                                .build())
                        .build())
                .collect(Collectors.toList());

        TopicContractRegistry registry = new TopicContractRegistry(contracts);
        log.info("Registered queue topics: {}", registry.topicKeys());
        return registry;
    }

    /**
     * Redis first, process-local map when Redis is unreachable. The Redis connection
     * factory connects lazily and is shared by every call.
     */
    @Bean
    public IdempotencyRecordRepository idempotencyRecordRepository(StringRedisTemplate redisTemplate,
                                                                   ObjectMapper objectMapper,
                                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                                   MeterRegistry meterRegistry,
                                                                   QueueRuntimeProperties properties,
                                                                   Clock clock) {
        QueueRuntimeProperties.Idempotency settings = properties.getIdempotency();
        return new FallbackIdempotencyRecordRepository(
                new RedisIdempotencyRecordRepository(redisTemplate, objectMapper, settings.getKeyPrefix()),
                new InMemoryIdempotencyRecordRepository(clock),
                circuitBreakerRegistry.circuitBreaker(settings.getCircuitBreaker()),
                meterRegistry);
    }
}

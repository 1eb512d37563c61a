package com.marketplace.infrastructure.persistence.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.infrastructure.persistence.entity.IdempotencyRecordEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed idempotency records.
 *
 * Claims use SET NX with an expiry, so concurrent deliveries of the same key on any
 * instance resolve to exactly one first sighting. Records are stored as JSON and
 * expire on their own.
 */
@Slf4j
public class RedisIdempotencyRecordRepository implements IdempotencyRecordRepository {

    private static final int MAX_CLAIM_ATTEMPTS = 3;

    private static final RedisScript<Long> DELETE_IF_MATCHES = new DefaultRedisScript<>(
            "local value = redis.call('GET', KEYS[1]) "
                    + "if value and cjson.decode(value)['fingerprint'] == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisIdempotencyRecordRepository(StringRedisTemplate redisTemplate,
                                            ObjectMapper objectMapper,
                                            String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<IdempotencyRecordEntity> saveIfAbsent(IdempotencyRecordEntity record, Duration ttl) {
        String redisKey = keyPrefix + record.getKey();
        String value = write(record);

        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            Boolean stored = redisTemplate.opsForValue().setIfAbsent(redisKey, value, ttl);
            if (Boolean.TRUE.equals(stored)) {
                return Optional.empty();
            }

            String existing = redisTemplate.opsForValue().get(redisKey);
            if (existing != null) {
                return Optional.of(read(existing));
            }
            // expired between SET NX and GET
            log.debug("Idempotency record {} vanished before it could be read, claiming again", redisKey);
        }
        throw new IllegalStateException("Could not claim idempotency key " + redisKey);
    }

    @Override
    public boolean deleteIfMatches(String key, String fingerprint) {
        Long deleted = redisTemplate.execute(DELETE_IF_MATCHES, List.of(keyPrefix + key), fingerprint);
        return deleted != null && deleted > 0;
    }

    private String write(IdempotencyRecordEntity record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize idempotency record " + record.getKey(), e);
        }
    }

    private IdempotencyRecordEntity read(String json) {
        try {
            return objectMapper.readValue(json, IdempotencyRecordEntity.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt idempotency record: " + json, e);
        }
    }
}

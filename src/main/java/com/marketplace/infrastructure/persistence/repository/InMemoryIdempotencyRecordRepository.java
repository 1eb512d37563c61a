package com.marketplace.infrastructure.persistence.repository;

import com.marketplace.infrastructure.persistence.entity.IdempotencyRecordEntity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local idempotency records.
 *
 * Used when the shared cache cannot be reached. Guarantees only hold within this JVM
 * and are lost on restart: two instances can both treat the same key as new.
 */
@Slf4j
public class InMemoryIdempotencyRecordRepository implements IdempotencyRecordRepository {

    private static final int SWEEP_INTERVAL = 1024;

    private final Map<String, IdempotencyRecordEntity> records = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();
    private final Clock clock;

    public InMemoryIdempotencyRecordRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecordEntity> saveIfAbsent(IdempotencyRecordEntity record, Duration ttl) {
        Instant now = clock.instant();
        AtomicReference<IdempotencyRecordEntity> existing = new AtomicReference<>();

        // compute() runs atomically per key
        records.compute(record.getKey(), (key, current) -> {
            if (current != null && !current.isExpiredAt(now)) {
                existing.set(current);
                return current;
            }
            return record;
        });

        if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
            purgeExpired(now);
        }
        return Optional.ofNullable(existing.get());
    }

    @Override
    public boolean deleteIfMatches(String key, String fingerprint) {
        AtomicBoolean deleted = new AtomicBoolean();
        records.computeIfPresent(key, (k, current) -> {
            if (current.getFingerprint().equals(fingerprint)) {
                deleted.set(true);
                return null;
            }
            return current;
        });
        return deleted.get();
    }

    public int size() {
        return records.size();
    }

    void purgeExpired(Instant now) {
        int before = records.size();
        records.values().removeIf(record -> record.isExpiredAt(now));
        log.debug("Purged {} expired in-memory idempotency records", before - records.size());
    }
}

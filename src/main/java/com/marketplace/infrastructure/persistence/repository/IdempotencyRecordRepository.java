package com.marketplace.infrastructure.persistence.repository;

import com.marketplace.infrastructure.persistence.entity.IdempotencyRecordEntity;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value storage for idempotency records with set-if-absent semantics.
 */
public interface IdempotencyRecordRepository {

    /**
     * Atomically store the record unless a live record already exists for its key.
     *
     * @return the existing record, or empty if this call stored {@code record}
     */
    Optional<IdempotencyRecordEntity> saveIfAbsent(IdempotencyRecordEntity record, Duration ttl);

    /**
     * Delete the record for {@code key} if it still carries {@code fingerprint}.
     *
     * @return true if a record was deleted
     */
    boolean deleteIfMatches(String key, String fingerprint);
}

package com.marketplace.domain.service;

import com.marketplace.config.QueueRuntimeProperties;
import com.marketplace.domain.model.IdempotencyCheck;
import com.marketplace.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.marketplace.infrastructure.persistence.repository.IdempotencyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Idempotency service for duplicate and key-reuse detection.
 *
 * Each (scope, idempotency key) pair is claimed once with an atomic set-if-absent on
 * the record repository. The record holds a fingerprint of the payload, so a repeat
 * sighting can be told apart:
 * - same fingerprint: a safe duplicate, the effect already happened
 * - different fingerprint: two distinct payloads share one key, reported as a conflict
 *
 * Idempotency is opt-in per call: without a key every call is fresh.
 *
 * Records expire after the configured TTL (24 hours by default). They are advisory
 * markers, not a ledger of record.
 */
@Slf4j
@Service
public class IdempotencyService {

    private final IdempotencyRecordRepository idempotencyRepository;
    private final PayloadFingerprinter fingerprinter;
    private final Clock clock;
    private final Duration ttl;

    public IdempotencyService(IdempotencyRecordRepository idempotencyRepository,
                              PayloadFingerprinter fingerprinter,
                              Clock clock,
                              QueueRuntimeProperties properties) {
        this.idempotencyRepository = idempotencyRepository;
        this.fingerprinter = fingerprinter;
        this.clock = clock;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * Claim the key for this payload, or report how an earlier claim relates to it.
     *
     * @param scope          namespace of the key, normally the topic key
     * @param idempotencyKey caller-supplied key; {@code null} or blank disables the check
     * @param payload        validated payload to fingerprint
     */
    public IdempotencyCheck checkAndStore(String scope, String idempotencyKey, Object payload) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return IdempotencyCheck.fresh();
        }

        Instant now = clock.instant();
        IdempotencyRecordEntity record = IdempotencyRecordEntity.builder()
                .key(recordKey(scope, idempotencyKey))
                .fingerprint(fingerprinter.fingerprint(payload))
                .seenAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        Optional<IdempotencyRecordEntity> existing = idempotencyRepository.saveIfAbsent(record, ttl);

        if (existing.isEmpty()) {
            log.debug("Stored idempotency record for key: {}", record.getKey());
            return IdempotencyCheck.claimed(record.getFingerprint());
        }

        if (existing.get().getFingerprint().equals(record.getFingerprint())) {
            log.info("Duplicate delivery detected for key: {}", record.getKey());
            return IdempotencyCheck.duplicate();
        }

        String message = String.format(
                "Idempotency key '%s' in scope '%s' was first seen at %s with a different payload",
                idempotencyKey, scope, existing.get().getSeenAt());
        log.warn("Idempotency conflict: {}", message);
        return IdempotencyCheck.conflict(message);
    }

    /**
     * Give the key back after a failed attempt so its redelivery is not taken for a
     * duplicate. Only the record stored by {@code claim} is removed; a record claimed by
     * a different payload is left alone.
     */
    public void release(String scope, String idempotencyKey, IdempotencyCheck claim) {
        if (idempotencyKey == null || idempotencyKey.isBlank() || claim.getFingerprint() == null) {
            return;
        }
        String key = recordKey(scope, idempotencyKey);
        if (idempotencyRepository.deleteIfMatches(key, claim.getFingerprint())) {
            log.debug("Released idempotency record for key: {}", key);
        }
    }

    static String recordKey(String scope, String idempotencyKey) {
        return scope + ":" + idempotencyKey;
    }
}

package com.marketplace.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Idempotency marker for one (scope, key) pair.
 *
 * Stored as JSON in the cache under the prefixed key, or in the process-local map when
 * the cache is unavailable. The fingerprint is what distinguishes a safe duplicate from
 * a key reused for a different payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordEntity {

    private String key;

    private String fingerprint;

    private Instant seenAt;

    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}

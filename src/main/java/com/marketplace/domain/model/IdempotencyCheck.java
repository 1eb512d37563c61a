package com.marketplace.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Answer of the idempotency store for one (scope, key) sighting.
 *
 * A fresh claim carries the fingerprint it was stored under; releasing the claim
 * must use that value, not a fingerprint taken after the handler ran.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdempotencyCheck {

    private static final IdempotencyCheck UNKEYED = new IdempotencyCheck(false, false, null, null);
    private static final IdempotencyCheck DUPLICATE = new IdempotencyCheck(true, false, null, null);

    boolean duplicate;
    boolean conflict;
    String message;
    String fingerprint;

    public static IdempotencyCheck fresh() {
        return UNKEYED;
    }

    public static IdempotencyCheck claimed(String fingerprint) {
        return new IdempotencyCheck(false, false, null, fingerprint);
    }

    public static IdempotencyCheck duplicate() {
        return DUPLICATE;
    }

    public static IdempotencyCheck conflict(String message) {
        return new IdempotencyCheck(true, true, message, null);
    }
}

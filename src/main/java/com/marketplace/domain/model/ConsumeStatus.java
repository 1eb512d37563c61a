package com.marketplace.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a single consumer invocation.
 */
public enum ConsumeStatus {

    PROCESSED("processed"),
    DUPLICATE("duplicate"),
    IDEMPOTENCY_CONFLICT("idempotency_conflict"),
    RETRY("retry"),
    DLQ("dlq");

    private final String wireName;

    ConsumeStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

package com.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Marketplace Queue Consumer Runtime
 *
 * Consumes marketplace events (payment settlement, inventory sync, invoice issuance)
 * with at-least-once delivery and idempotent suppression of duplicate effects.
 *
 * Architecture:
 * - Typed payload contracts validated before any side effect
 * - Redis-backed idempotency with an in-process fallback
 * - Fixed-delay retry per topic, then dead-letter
 * - Transport-agnostic core; Kafka adapter for requeue, dead-letter and consumption
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QueueRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueueRuntimeApplication.class, args);
    }
}

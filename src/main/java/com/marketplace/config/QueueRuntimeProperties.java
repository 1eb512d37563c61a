package com.marketplace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under {@code app.queue}.
 *
 * When no topics are configured the built-in marketplace topics are used.
 */
@Data
@ConfigurationProperties(prefix = "app.queue")
public class QueueRuntimeProperties {

    private Idempotency idempotency = new Idempotency();

    private Map<String, Topic> topics = new LinkedHashMap<>();

    private Listener listener = new Listener();

    private Kafka kafka = new Kafka();

    @Data
    public static class Idempotency {
        private Duration ttl = Duration.ofHours(24);
        private String keyPrefix = "fbm:queue:idempotency:";
        private String circuitBreaker = "idempotencyStore";
    }

    @Data
    public static class Topic {
        private String wireTopic;
        private String purpose;
        private String contract;
        private int maxRetries;
        private long backoffSeconds;
        private String deadLetterTopic;
    }

    @Data
    public static class Listener {
        private boolean enabled = false;
        private String groupId = "marketplace-queue-runtime";
    }

    @Data
    public static class Kafka {
        private Duration sendTimeout = Duration.ofSeconds(10);
    }
}

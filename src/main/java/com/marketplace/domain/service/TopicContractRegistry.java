package com.marketplace.domain.service;

import com.marketplace.domain.exception.UnknownTopicException;
import com.marketplace.domain.model.PayloadContract;
import com.marketplace.domain.model.RetryPolicy;
import com.marketplace.domain.model.TopicContract;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of queue topics.
 *
 * Built once at startup and injected wherever a topic needs resolving. Construction
 * fails on inconsistent entries so a bad configuration stops the process instead of
 * silently dropping messages later.
 */
public final class TopicContractRegistry {

    public static final String PAYMENTS_SETTLEMENT = "payments_settlement";
    public static final String INVENTORY_SYNC = "inventory_sync";
    public static final String INVOICE_ISSUANCE = "invoice_issuance";

    private final Map<String, TopicContract> byKey;
    private final Map<String, TopicContract> byWireTopic;

    public TopicContractRegistry(Collection<TopicContract> contracts) {
        Map<String, TopicContract> keys = new LinkedHashMap<>();
        Map<String, TopicContract> wires = new LinkedHashMap<>();

        for (TopicContract contract : contracts) {
            validate(contract);
            if (keys.putIfAbsent(contract.getTopicKey(), contract) != null) {
                throw new IllegalArgumentException("Duplicate topic key: " + contract.getTopicKey());
            }
            if (wires.putIfAbsent(contract.getWireTopic(), contract) != null) {
                throw new IllegalArgumentException("Duplicate wire topic: " + contract.getWireTopic());
            }
        }

        this.byKey = Map.copyOf(keys);
        this.byWireTopic = Map.copyOf(wires);
    }

    /**
     * Registry holding the marketplace's built-in topics.
     */
    public static TopicContractRegistry defaults() {
        return new TopicContractRegistry(List.of(
                topic(PAYMENTS_SETTLEMENT, "payments.settlement.v1",
                        "Settle captured payments against marketplace orders",
                        PayloadContract.ORDER_SYNC_STATUS, 5, 30),
                topic(INVENTORY_SYNC, "inventory.sync.v1",
                        "Apply inventory ledger deltas to stock levels",
                        PayloadContract.INVENTORY_LEDGER_EVENT, 8, 15),
                topic(INVOICE_ISSUANCE, "invoice.issuance.v1",
                        "Issue invoices for completed orders",
                        PayloadContract.INVOICE, 6, 20)
        ));
    }

    public TopicContract get(String topicKey) {
        TopicContract contract = topicKey == null ? null : byKey.get(topicKey);
        if (contract == null) {
            throw new UnknownTopicException(topicKey);
        }
        return contract;
    }

    public Optional<TopicContract> findByWireTopic(String wireTopic) {
        return Optional.ofNullable(byWireTopic.get(wireTopic));
    }

    /**
     * Startup check that every key a component depends on is registered.
     */
    public void requireTopics(Collection<String> topicKeys) {
        topicKeys.forEach(this::get);
    }

    public Set<String> topicKeys() {
        return byKey.keySet();
    }

    public String[] wireTopics() {
        return byWireTopic.keySet().toArray(String[]::new);
    }

    private static TopicContract topic(String key, String wireTopic, String purpose,
                                       PayloadContract contract, int maxRetries, long backoffSeconds) {
        String deadLetterTopic = wireTopic.substring(0, wireTopic.lastIndexOf(".v1")) + ".dlq.v1";
        return TopicContract.builder()
                .topicKey(key)
                .wireTopic(wireTopic)
                .purpose(purpose)
                .payloadContract(contract)
                .policy(RetryPolicy.builder()
                        .maxRetries(maxRetries)
                        .backoffSeconds(backoffSeconds)
                        .deadLetterTopic(deadLetterTopic)
                        .build())
                .build();
    }

    private static void validate(TopicContract contract) {
        if (isBlank(contract.getTopicKey()) || isBlank(contract.getWireTopic())) {
            throw new IllegalArgumentException("Topic key and wire topic are required: " + contract);
        }
        if (contract.getPayloadContract() == null) {
            throw new IllegalArgumentException("No payload contract for topic " + contract.getTopicKey());
        }
        RetryPolicy policy = contract.getPolicy();
        if (policy == null || policy.getMaxRetries() < 0 || policy.getBackoffSeconds() < 0) {
            throw new IllegalArgumentException("Invalid retry policy for topic " + contract.getTopicKey());
        }
        if (isBlank(policy.getDeadLetterTopic())) {
            throw new IllegalArgumentException("No dead-letter topic for " + contract.getTopicKey());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

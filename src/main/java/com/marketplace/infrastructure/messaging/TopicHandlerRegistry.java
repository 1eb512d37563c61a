package com.marketplace.infrastructure.messaging;

import com.marketplace.domain.model.TopicContract;
import com.marketplace.domain.service.TopicContractRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps topic keys to their handler beans.
 *
 * Fails at startup when a handler names an unknown topic, declares the wrong payload
 * type, or shares its topic with another handler.
 */
@Slf4j
@Component
public class TopicHandlerRegistry {

    private final TopicContractRegistry topicRegistry;
    private final Map<String, TopicHandler<?>> handlers;

    public TopicHandlerRegistry(TopicContractRegistry topicRegistry, ObjectProvider<TopicHandler<?>> handlerBeans) {
        this.topicRegistry = topicRegistry;

        Map<String, TopicHandler<?>> byTopic = new LinkedHashMap<>();
        handlerBeans.orderedStream().forEach(handler -> {
            TopicContract topic = topicRegistry.get(handler.topicKey());
            if (!topic.getPayloadContract().getPayloadType().equals(handler.payloadType())) {
                throw new IllegalStateException("Handler " + handler.getClass().getName() + " for "
                        + handler.topicKey() + " expects " + handler.payloadType().getSimpleName()
                        + " but the topic carries " + topic.getPayloadContract().getPayloadType().getSimpleName());
            }
            if (byTopic.putIfAbsent(handler.topicKey(), handler) != null) {
                throw new IllegalStateException("More than one handler for topic " + handler.topicKey());
            }
        });

        this.handlers = Map.copyOf(byTopic);
        log.info("Queue handlers registered for topics: {}", byTopic.keySet());
    }

    public Optional<TopicHandler<?>> find(String topicKey) {
        return Optional.ofNullable(handlers.get(topicKey));
    }

    /**
     * Wire topics that have a handler, for the listener subscription.
     */
    public String[] wireTopics() {
        return handlers.keySet().stream()
                .map(key -> topicRegistry.get(key).getWireTopic())
                .toArray(String[]::new);
    }
}

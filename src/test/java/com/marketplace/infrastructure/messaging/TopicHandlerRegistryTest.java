package com.marketplace.infrastructure.messaging;

import com.marketplace.domain.exception.UnknownTopicException;
import com.marketplace.domain.model.contract.Invoice;
import com.marketplace.domain.model.contract.InventoryLedgerEvent;
import com.marketplace.domain.service.TopicContractRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TopicHandlerRegistryTest {

    @Mock private ObjectProvider<TopicHandler<?>> handlerBeans;

    private final TopicContractRegistry topicRegistry = TopicContractRegistry.defaults();

    @Test
    void registersHandlersByTopic() {
        TopicHandler<InventoryLedgerEvent> inventory = new StubHandler<>("inventory_sync", InventoryLedgerEvent.class);
        when(handlerBeans.orderedStream()).thenReturn(Stream.of(inventory));

        TopicHandlerRegistry registry = new TopicHandlerRegistry(topicRegistry, handlerBeans);

        assertSame(inventory, registry.find("inventory_sync").orElseThrow());
        assertTrue(registry.find("invoice_issuance").isEmpty());
        assertArrayEquals(new String[]{"inventory.sync.v1"}, registry.wireTopics());
    }

    @Test
    void rejectsHandlerForUnknownTopic() {
        when(handlerBeans.orderedStream())
                .thenReturn(Stream.of(new StubHandler<>("returns", Invoice.class)));

        assertThrows(UnknownTopicException.class, () -> new TopicHandlerRegistry(topicRegistry, handlerBeans));
    }

    @Test
    void rejectsHandlerWithWrongPayloadType() {
        when(handlerBeans.orderedStream())
                .thenReturn(Stream.of(new StubHandler<>("invoice_issuance", InventoryLedgerEvent.class)));

        assertThrows(IllegalStateException.class, () -> new TopicHandlerRegistry(topicRegistry, handlerBeans));
    }

    @Test
    void rejectsSecondHandlerForSameTopic() {
        when(handlerBeans.orderedStream()).thenReturn(Stream.of(
                new StubHandler<>("invoice_issuance", Invoice.class),
                new StubHandler<>("invoice_issuance", Invoice.class)));

        assertThrows(IllegalStateException.class, () -> new TopicHandlerRegistry(topicRegistry, handlerBeans));
    }

    @Test
    void noHandlers_isAllowed() {
        when(handlerBeans.orderedStream()).thenReturn(Stream.empty());

        TopicHandlerRegistry registry = new TopicHandlerRegistry(topicRegistry, handlerBeans);

        assertEquals(0, registry.wireTopics().length);
    }

    static final class StubHandler<T> implements TopicHandler<T> {

        private final String topicKey;
        private final Class<T> payloadType;

        StubHandler(String topicKey, Class<T> payloadType) {
            this.topicKey = topicKey;
            this.payloadType = payloadType;
        }

        @Override
        public String topicKey() {
            return topicKey;
        }

        @Override
        public Class<T> payloadType() {
            return payloadType;
        }

        @Override
        public void handle(T payload) {
        }
    }
}

package com.marketplace.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.domain.exception.ContractViolationException;
import com.marketplace.domain.exception.UnknownTopicException;
import com.marketplace.domain.model.PayloadContract;
import com.marketplace.domain.model.contract.InventoryLedgerEvent;
import com.marketplace.domain.model.contract.Invoice;
import com.marketplace.domain.model.contract.PickPackBatch;
import com.marketplace.domain.model.contract.SalesChannel;
import com.marketplace.domain.model.contract.WeightPriceRule;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadContractValidatorTest {

    private PayloadContractValidator contractValidator;

    @BeforeEach
    void setUp() {
        contractValidator = new PayloadContractValidator(TopicContractRegistry.defaults(),
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    void validInventoryEvent_bindsToTypedPayload() {
        InventoryLedgerEvent event = contractValidator.validate(
                TopicContractRegistry.INVENTORY_SYNC, inventoryPayload(), InventoryLedgerEvent.class);

        assertEquals("evt_1", event.getEventId());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), event.getOccurredAt());
        assertEquals(-3, event.getDelta());
        assertEquals(SalesChannel.STOREFRONT, event.getChannel());
        assertNull(event.getIdempotencyKey());
    }

    @Test
    void jsonStringAndTree_areAccepted() throws Exception {
        String json = new ObjectMapper().writeValueAsString(inventoryPayload());

        InventoryLedgerEvent fromString = contractValidator.validate(
                TopicContractRegistry.INVENTORY_SYNC, json, InventoryLedgerEvent.class);
        InventoryLedgerEvent fromTree = contractValidator.validate(
                TopicContractRegistry.INVENTORY_SYNC, new ObjectMapper().readTree(json), InventoryLedgerEvent.class);

        assertEquals(fromString, fromTree);
    }

    @Test
    void unknownField_isRejected() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("location", "aisle-4");

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertEquals(List.of("location: is not an allowed field"), e.getViolations());
    }

    @Test
    void channelOutsideClosedSet_isRejected() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("channel", "telephone");

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertTrue(e.getViolations().get(0).startsWith("channel:"));
    }

    @Test
    void numericStringForIntegerDelta_isNotCoerced() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("delta", "1");

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertTrue(e.getViolations().get(0).startsWith("delta:"));
    }

    @Test
    void fractionalDelta_isRejected() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("delta", 1.5);

        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));
    }

    @Test
    void enumOrdinal_isNotAcceptedForChannel() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("channel", 0);

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertTrue(e.getViolations().get(0).startsWith("channel:"));
    }

    @Test
    void numberForStringField_isNotCoerced() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("event_id", 123);

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertTrue(e.getViolations().get(0).startsWith("event_id:"));
    }

    @Test
    void booleanAndFloatForStringField_areNotCoerced() {
        Map<String, Object> withBoolean = inventoryPayload();
        withBoolean.put("event_id", true);
        Map<String, Object> withFloat = inventoryPayload();
        withFloat.put("reason", 2.5);

        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, withBoolean, InventoryLedgerEvent.class));
        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, withFloat, InventoryLedgerEvent.class));
    }

    @Test
    void epochSecondsForTimestamp_isRejected() {
        Map<String, Object> payload = inventoryPayload();
        payload.put("occurred_at", 1704067200);

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertTrue(e.getViolations().get(0).startsWith("occurred_at:"));
    }

    @Test
    void numericOrderIdInBatch_isNotCoerced() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("batch_id", "batch_1");
        payload.put("order_ids", List.of("ord_1", 42));
        payload.put("status", "open");
        payload.put("created_at", "2024-01-01T00:00:00Z");

        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(PayloadContract.PICK_PACK_BATCH, payload));
    }

    @Test
    void missingFields_areAllReportedSorted() {
        Map<String, Object> payload = inventoryPayload();
        payload.remove("reason");
        payload.remove("event_id");

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, payload, InventoryLedgerEvent.class));

        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().get(0).startsWith("event_id:"));
        assertTrue(e.getViolations().get(1).startsWith("reason:"));
    }

    @Test
    void nullAndMalformedPayloads_areRejected() {
        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, null, InventoryLedgerEvent.class));
        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVENTORY_SYNC, "{not json", InventoryLedgerEvent.class));
    }

    @Test
    void unknownTopic_isAConfigurationError() {
        assertThrows(UnknownTopicException.class, () ->
                contractValidator.validate("loyalty_points", inventoryPayload(), InventoryLedgerEvent.class));
    }

    @Test
    void invoice_requiresUpperCaseCurrencyAndNonNegativeTotal() {
        Map<String, Object> payload = invoicePayload();
        payload.put("currency_code", "usd");
        payload.put("total", -1);

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVOICE_ISSUANCE, payload, Invoice.class));

        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().get(0).startsWith("currency_code:"));
        assertTrue(e.getViolations().get(1).startsWith("total:"));
    }

    @Test
    void invoiceStatus_mustBeKnown() {
        Map<String, Object> payload = invoicePayload();
        payload.put("status", "lost");

        assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(TopicContractRegistry.INVOICE_ISSUANCE, payload, Invoice.class));

        Invoice invoice = contractValidator.validate(
                TopicContractRegistry.INVOICE_ISSUANCE, invoicePayload(), Invoice.class);
        assertEquals(Invoice.Status.ISSUED, invoice.getStatus());
        assertEquals(100, invoice.getTotal());
    }

    @Test
    void weightPriceRule_rejectsInvertedWeightRange() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("rule_id", "rule_1");
        payload.put("product_id", "prod_1");
        payload.put("unit", "kg");
        payload.put("price_per_unit", 1299);
        payload.put("currency_code", "EUR");
        payload.put("min_weight", 5);
        payload.put("max_weight", 2);

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(PayloadContract.WEIGHT_PRICE_RULE, payload));
        assertEquals(List.of("weight_range_valid: max_weight must not be below min_weight"), e.getViolations());

        payload.put("max_weight", 10);
        WeightPriceRule rule = (WeightPriceRule) contractValidator.validate(PayloadContract.WEIGHT_PRICE_RULE, payload);
        assertEquals(WeightPriceRule.WeightUnit.KILOGRAM, rule.getUnit());
    }

    @Test
    void pickPackBatch_requiresAtLeastOneOrder() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("batch_id", "batch_1");
        payload.put("order_ids", List.of());
        payload.put("status", "picking");
        payload.put("created_at", "2024-01-01T08:30:00Z");

        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
                contractValidator.validate(PayloadContract.PICK_PACK_BATCH, payload));
        assertTrue(e.getViolations().get(0).startsWith("order_ids:"));

        payload.put("order_ids", List.of("ord_1", "ord_2"));
        PickPackBatch batch = (PickPackBatch) contractValidator.validate(PayloadContract.PICK_PACK_BATCH, payload);
        assertEquals(PickPackBatch.Status.PICKING, batch.getStatus());
        assertEquals(2, batch.getOrderIds().size());
    }

    private static Map<String, Object> inventoryPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event_id", "evt_1");
        payload.put("occurred_at", "2024-01-01T00:00:00Z");
        payload.put("product_id", "prod_1");
        payload.put("variant_id", "var_1");
        payload.put("delta", -3);
        payload.put("reason", "stock count");
        payload.put("channel", "storefront");
        return payload;
    }

    private static Map<String, Object> invoicePayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("invoice_id", "inv_1");
        payload.put("order_id", "ord_1");
        payload.put("status", "issued");
        payload.put("total", 100);
        payload.put("currency_code", "USD");
        payload.put("issued_at", "2024-01-01T00:00:00Z");
        return payload;
    }
}

package com.marketplace.domain.model;

import com.marketplace.domain.model.contract.InventoryLedgerEvent;
import com.marketplace.domain.model.contract.Invoice;
import com.marketplace.domain.model.contract.OrderSyncStatusEvent;
import com.marketplace.domain.model.contract.PickPackBatch;
import com.marketplace.domain.model.contract.WeightPriceRule;

import java.util.Arrays;

/**
 * Closed set of payload schemas. Each constant binds a contract key to the typed
 * class the validator produces for it.
 */
public enum PayloadContract {

    INVENTORY_LEDGER_EVENT("inventory_ledger_event", InventoryLedgerEvent.class),
    ORDER_SYNC_STATUS("order_sync_status", OrderSyncStatusEvent.class),
    WEIGHT_PRICE_RULE("weight_price_rule", WeightPriceRule.class),
    PICK_PACK_BATCH("pick_pack_batch", PickPackBatch.class),
    INVOICE("invoice", Invoice.class);

    private final String key;
    private final Class<?> payloadType;

    PayloadContract(String key, Class<?> payloadType) {
        this.key = key;
        this.payloadType = payloadType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public static PayloadContract fromKey(String key) {
        return Arrays.stream(values())
                .filter(contract -> contract.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payload contract: " + key));
    }
}

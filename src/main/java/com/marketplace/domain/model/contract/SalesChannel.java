package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sales channel an inventory movement or order originated from.
 */
public enum SalesChannel {
    @JsonProperty("storefront") STOREFRONT,
    @JsonProperty("pos") POS,
    @JsonProperty("wholesale") WHOLESALE,
    @JsonProperty("marketplace") MARKETPLACE
}

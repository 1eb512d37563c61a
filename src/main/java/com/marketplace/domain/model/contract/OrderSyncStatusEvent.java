package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Order status change propagated between the storefront and settlement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderSyncStatusEvent {

    @NotBlank
    private String eventId;

    @NotBlank
    private String orderId;

    @NotNull
    private Instant occurredAt;

    @NotNull
    private Status status;

    @NotNull
    private SalesChannel channel;

    public enum Status {
        @JsonProperty("pending") PENDING,
        @JsonProperty("authorized") AUTHORIZED,
        @JsonProperty("paid") PAID,
        @JsonProperty("settled") SETTLED,
        @JsonProperty("fulfilled") FULFILLED,
        @JsonProperty("cancelled") CANCELLED,
        @JsonProperty("refunded") REFUNDED
    }
}

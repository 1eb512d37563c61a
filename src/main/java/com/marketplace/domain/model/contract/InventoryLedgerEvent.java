package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
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
 * Signed stock movement for one product variant.
 *
 * A positive delta adds stock, a negative delta removes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InventoryLedgerEvent {

    @NotBlank
    private String eventId;

    @NotNull
    private Instant occurredAt;

    @NotBlank
    private String productId;

    @NotBlank
    private String variantId;

    @NotNull
    private Integer delta;

    @NotBlank
    private String reason;

    @NotNull
    private SalesChannel channel;

    private String idempotencyKey;
}

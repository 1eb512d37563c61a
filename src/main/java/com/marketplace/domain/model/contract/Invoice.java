package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Invoice issued for an order. The total is in minor currency units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Invoice {

    @NotBlank
    private String invoiceId;

    @NotBlank
    private String orderId;

    @NotNull
    private Status status;

    @NotNull
    @PositiveOrZero
    private Integer total;

    @NotNull
    @Pattern(regexp = "^[A-Z]{3}$", message = "must be a 3-letter upper-case currency code")
    private String currencyCode;

    @NotNull
    private Instant issuedAt;

    public enum Status {
        @JsonProperty("draft") DRAFT,
        @JsonProperty("issued") ISSUED,
        @JsonProperty("paid") PAID,
        @JsonProperty("void") VOID
    }
}

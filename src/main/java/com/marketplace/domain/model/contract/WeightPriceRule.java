package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Price for products sold by weight. Prices are in minor currency units per
 * weight unit; weights are whole units of {@link #unit}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WeightPriceRule {

    @NotBlank
    private String ruleId;

    @NotBlank
    private String productId;

    private String variantId;

    @NotNull
    private WeightUnit unit;

    @NotNull
    @PositiveOrZero
    private Integer pricePerUnit;

    @NotNull
    @Pattern(regexp = "^[A-Z]{3}$", message = "must be a 3-letter upper-case currency code")
    private String currencyCode;

    @NotNull
    @PositiveOrZero
    private Integer minWeight;

    @PositiveOrZero
    private Integer maxWeight;

    @JsonIgnore
    @AssertTrue(message = "max_weight must not be below min_weight")
    public boolean isWeightRangeValid() {
        return maxWeight == null || minWeight == null || maxWeight >= minWeight;
    }

    public enum WeightUnit {
        @JsonProperty("g") GRAM,
        @JsonProperty("kg") KILOGRAM,
        @JsonProperty("oz") OUNCE,
        @JsonProperty("lb") POUND
    }
}

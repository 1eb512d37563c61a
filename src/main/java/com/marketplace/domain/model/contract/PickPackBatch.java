package com.marketplace.domain.model.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Group of orders picked and packed together by one fulfilment operator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PickPackBatch {

    @NotBlank
    private String batchId;

    @NotEmpty
    private List<@NotBlank String> orderIds;

    @NotNull
    private Status status;

    private String assignedTo;

    @NotNull
    private Instant createdAt;

    public enum Status {
        @JsonProperty("open") OPEN,
        @JsonProperty("picking") PICKING,
        @JsonProperty("packing") PACKING,
        @JsonProperty("packed") PACKED,
        @JsonProperty("shipped") SHIPPED
    }
}

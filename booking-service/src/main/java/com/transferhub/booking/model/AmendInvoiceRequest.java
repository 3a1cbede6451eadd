package com.transferhub.booking.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Null {@code lineItems} keeps the original lines; null {@code taxRatePercent} keeps the original rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmendInvoiceRequest {

    @NotBlank
    private String reason;

    @Valid
    private List<LineItemRequest> lineItems;

    @PositiveOrZero
    @DecimalMax("100")
    private BigDecimal taxRatePercent;

    private String notes;
}

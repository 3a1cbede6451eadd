package com.transferhub.booking.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomInvoiceRequest {

    @NotBlank
    private String billToName;

    @Email
    private String billToEmail;

    @NotEmpty
    @Valid
    private List<LineItemRequest> lineItems;

    @PositiveOrZero
    @DecimalMax("100")
    @Builder.Default
    private BigDecimal taxRatePercent = BigDecimal.ZERO;

    @PositiveOrZero
    private Integer dueInDays;

    private String notes;
}

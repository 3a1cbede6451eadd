package com.transferhub.booking.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemRequest {

    @NotBlank
    private String description;

    @NotNull
    @Positive
    @Builder.Default
    private BigDecimal quantity = BigDecimal.ONE;

    @NotNull
    private BigDecimal unitPrice;

    private LocalDate serviceDate;
}

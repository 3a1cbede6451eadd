package com.transferhub.booking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.math.BigDecimal;

/**
 * Add-on charged to the customer. When {@code affectsDriverCost} is set the same amount
 * is also owed to the driver, so it does not change profit.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingExtra {

    @NotBlank
    @Column(name = "name", nullable = false)
    private String name;

    @PositiveOrZero
    @Column(name = "price", precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "affects_driver_cost", nullable = false)
    private boolean affectsDriverCost;
}

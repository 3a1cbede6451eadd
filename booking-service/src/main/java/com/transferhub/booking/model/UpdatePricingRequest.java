package com.transferhub.booking.model;

import com.transferhub.booking.entity.BookingExtra;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Null fields keep their current value. {@code extras}, when present, replaces the whole list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePricingRequest {

    @PositiveOrZero
    private BigDecimal customerPrice;

    @PositiveOrZero
    private BigDecimal driverPrice;

    @Valid
    private List<BookingExtra> extras;

    /** Version the caller last read; a mismatch is rejected as a concurrent modification. */
    private Long expectedVersion;
}

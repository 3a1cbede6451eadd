package com.transferhub.pricing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;

/**
 * One distance sub-range of a tiered tariff. At most one of fixedPrice / perMileRate
 * is meaningful; a bracket with neither contributes nothing.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MileageBracket {

    @Column(name = "min_miles", nullable = false)
    private double minMiles;

    /** Null means unbounded. */
    @Column(name = "max_miles")
    private Double maxMiles;

    @Column(name = "fixed_price", precision = 10, scale = 2)
    private BigDecimal fixedPrice;

    @Column(name = "per_mile_rate", precision = 10, scale = 4)
    private BigDecimal perMileRate;

    @Column(name = "bracket_order", nullable = false)
    private int order;

    public boolean isFirst() {
        return minMiles == 0.0;
    }

    public boolean hasPrice() {
        return fixedPrice != null || perMileRate != null;
    }
}

package com.transferhub.pricing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtraFees {

    @Column(name = "airport_pickup_fee", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal airportPickupFee = BigDecimal.ZERO;

    @Column(name = "meet_greet_fee", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal meetGreetFee = BigDecimal.ZERO;

    @Column(name = "night_surcharge_percent", precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal nightSurchargePercent = BigDecimal.ZERO;

    @Column(name = "weekend_surcharge_percent", precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal weekendSurchargePercent = BigDecimal.ZERO;

    @Column(name = "child_seat_fee", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal childSeatFee = BigDecimal.ZERO;

    @Column(name = "waiting_per_minute", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal waitingPerMinute = BigDecimal.ZERO;
}

package com.transferhub.pricing.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "legacy_rate_rules",
        indexes = {
                @Index(name = "idx_rate_rule_class", columnList = "vehicle_class_id", unique = true)
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class LegacyRateRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "vehicle_class_id", nullable = false, length = 64)
    private String vehicleClassId;

    @Column(name = "base_fee", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal baseFee = BigDecimal.ZERO;

    @Column(name = "per_km_rate", nullable = false, precision = 10, scale = 4)
    @Builder.Default
    private BigDecimal perKmRate = BigDecimal.ZERO;

    @Column(name = "minimum_fare", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal minimumFare = BigDecimal.ZERO;

    @Column(name = "airport_surcharge", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal airportSurcharge = BigDecimal.ZERO;

    @Column(name = "meet_greet_fee", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal meetGreetFee = BigDecimal.ZERO;

    @Column(name = "night_surcharge_percent", precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal nightSurchargePercent = BigDecimal.ZERO;

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "GBP";
}

package com.transferhub.pricing.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "pricing_schemes",
        indexes = {
                @Index(name = "idx_scheme_vehicle_class", columnList = "vehicle_class_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PricingScheme {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "vehicle_class_id", nullable = false, length = 64)
    private String vehicleClassId;

    @Column(name = "base_fare", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal baseFare = BigDecimal.ZERO;

    @Column(name = "minimum_fare", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal minimumFare = BigDecimal.ZERO;

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "GBP";

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mileage_brackets", joinColumns = @JoinColumn(name = "scheme_id"))
    @Builder.Default
    private List<MileageBracket> brackets = new ArrayList<>();

    @Embedded
    @Builder.Default
    private ExtraFees extraFees = new ExtraFees();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasBrackets() {
        return brackets != null && !brackets.isEmpty();
    }

    /**
     * Brackets in evaluation order. Returns a copy; the persistent list is untouched.
     */
    public List<MileageBracket> orderedBrackets() {
        if (!hasBrackets()) {
            return List.of();
        }
        List<MileageBracket> sorted = new ArrayList<>(brackets);
        sorted.sort(Comparator.comparingInt(MileageBracket::getOrder));
        return sorted;
    }

    /**
     * True when, sorted by order, a bracket starts before its predecessor ends
     * (or follows an unbounded one).
     */
    public boolean hasOverlappingBrackets() {
        List<MileageBracket> sorted = orderedBrackets();
        for (int i = 1; i < sorted.size(); i++) {
            MileageBracket prev = sorted.get(i - 1);
            MileageBracket next = sorted.get(i);
            if (prev.getMaxMiles() == null || next.getMinMiles() < prev.getMaxMiles()) {
                return true;
            }
        }
        return false;
    }

    public ExtraFees fees() {
        return extraFees != null ? extraFees : new ExtraFees();
    }
}

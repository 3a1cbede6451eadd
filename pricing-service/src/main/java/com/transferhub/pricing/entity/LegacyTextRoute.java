package com.transferhub.pricing.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Free-text route kept from the original tariff sheet. Matched by case-insensitive
 * substring containment, either way round, on both pickup and drop-off labels.
 */
@Entity
@Table(name = "legacy_text_routes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class LegacyTextRoute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    private String name;

    @Column(name = "pickup_label", nullable = false)
    private String pickupLabel;

    @Column(name = "dropoff_label", nullable = false)
    private String dropoffLabel;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "legacy_text_route_prices", joinColumns = @JoinColumn(name = "route_id"))
    @MapKeyColumn(name = "vehicle_class_id", length = 64)
    @Column(name = "price", precision = 10, scale = 2)
    @Builder.Default
    private Map<String, BigDecimal> prices = new HashMap<>();

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "GBP";

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean matches(String pickupLocation, String dropoffLocation) {
        return overlaps(pickupLabel, pickupLocation) && overlaps(dropoffLabel, dropoffLocation);
    }

    public boolean hasPriceFor(String vehicleClassId) {
        return prices != null && prices.get(vehicleClassId) != null;
    }

    // Blank text would be a substring of everything, so it never matches.
    private static boolean overlaps(String label, String requested) {
        if (label == null || requested == null || label.isBlank() || requested.isBlank()) {
            return false;
        }
        String a = label.trim().toLowerCase(Locale.ROOT);
        String b = requested.trim().toLowerCase(Locale.ROOT);
        return a.contains(b) || b.contains(a);
    }
}

package com.transferhub.pricing.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "geo_fixed_routes",
        indexes = {
                @Index(name = "idx_geo_route_class", columnList = "vehicle_class_id"),
                @Index(name = "idx_geo_route_priority", columnList = "priority")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class GeoFixedRoute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "vehicle_class_id", nullable = false, length = 64)
    private String vehicleClassId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "lat", column = @Column(name = "start_lat", nullable = false)),
            @AttributeOverride(name = "lng", column = @Column(name = "start_lng", nullable = false)),
            @AttributeOverride(name = "radiusMiles", column = @Column(name = "start_radius_miles", nullable = false))
    })
    private GeoZone start;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "lat", column = @Column(name = "end_lat", nullable = false)),
            @AttributeOverride(name = "lng", column = @Column(name = "end_lng", nullable = false)),
            @AttributeOverride(name = "radiusMiles", column = @Column(name = "end_radius_miles", nullable = false))
    })
    private GeoZone end;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "GBP";

    /** Higher is evaluated first. */
    @Column(name = "priority", nullable = false)
    private int priority;

    /** When true the route also matches end-to-start. */
    @Column(name = "valid_return", nullable = false)
    private boolean validReturn;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}

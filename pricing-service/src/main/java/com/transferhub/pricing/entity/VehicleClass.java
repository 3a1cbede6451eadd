package com.transferhub.pricing.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "vehicle_classes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class VehicleClass {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(name = "max_passengers", nullable = false)
    private int maxPassengers;

    @Column(name = "max_luggage", nullable = false)
    private int maxLuggage;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "sort_order")
    private int sortOrder;

    public boolean fits(int passengers, int luggage) {
        return maxPassengers >= passengers && maxLuggage >= luggage;
    }
}

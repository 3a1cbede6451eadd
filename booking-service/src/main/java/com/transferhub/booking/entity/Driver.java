package com.transferhub.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "drivers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Driver implements CommissionTerms {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    private String email;

    @Column(length = 32)
    private String phone;

    /** Owning fleet, null for independent drivers. */
    @Column(name = "fleet_id", length = 64)
    private String fleetId;

    @Column(length = 32)
    @Builder.Default
    private String status = "active";

    /** Null means no commission is deducted. */
    @Enumerated(EnumType.STRING)
    @Column(name = "commission_type", length = 16)
    private CommissionType commissionType;

    @Column(name = "commission_value", precision = 10, scale = 2)
    private BigDecimal commissionValue;

    @Column(name = "payment_terms", length = 32)
    private String paymentTerms;
}

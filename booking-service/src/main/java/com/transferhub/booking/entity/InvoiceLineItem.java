package com.transferhub.booking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Snapshot of what was billed. Copied from the booking at generation time and never
 * re-read, so later booking edits don't touch an existing invoice.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceLineItem {

    @Column(name = "booking_id")
    private UUID bookingId;

    @Column(name = "booking_ref", length = 8)
    private String bookingRef;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "service_date")
    private LocalDate serviceDate;

    @Column(name = "quantity", precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal quantity = BigDecimal.ONE;

    @Column(name = "unit_price", precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "amount", precision = 10, scale = 2)
    private BigDecimal amount;

    /** Customer invoices only: customerPrice - driverPrice for the booking. */
    @Column(name = "profit", precision = 10, scale = 2)
    private BigDecimal profit;
}

package com.transferhub.booking.entity;

import com.transferhub.booking.model.PriceAssignment;
import com.transferhub.booking.service.DualPriceAssigner;
import com.transferhub.shared.enums.BookingStatus;
import com.transferhub.shared.enums.InvoiceType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_booking_ref", columnList = "booking_ref", unique = true),
                @Index(name = "idx_booking_status", columnList = "status"),
                @Index(name = "idx_booking_fleet", columnList = "fleet_id"),
                @Index(name = "idx_booking_driver", columnList = "driver_id"),
                @Index(name = "idx_booking_customer_email", columnList = "customer_email")
        })
@Data
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Optimistic lock. Two concurrent reassignments both read version N; the second
     * commit finds N+1 and fails instead of overwriting the first one's profit.
     */
    @Version
    private Long version;

    @Column(name = "booking_ref", nullable = false, length = 8)
    private String bookingRef;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone", length = 32)
    private String customerPhone;

    @Column(name = "pickup_location", nullable = false)
    private String pickupLocation;

    @Column(name = "dropoff_location", nullable = false)
    private String dropoffLocation;

    @Column(name = "pickup_date", nullable = false)
    private LocalDate pickupDate;

    @Column(name = "pickup_time")
    private LocalTime pickupTime;

    @Column(name = "passengers")
    private int passengers;

    @Column(name = "vehicle_class_id", length = 64)
    private String vehicleClassId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingStatus status;

    @Column(name = "fleet_id")
    private String fleetId;

    @Column(name = "driver_id")
    private String driverId;

    @Setter(AccessLevel.NONE)
    @Column(name = "customer_price", precision = 10, scale = 2)
    private BigDecimal customerPrice;

    @Setter(AccessLevel.NONE)
    @Column(name = "driver_price", precision = 10, scale = 2)
    private BigDecimal driverPrice;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_extras", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "position")
    private List<BookingExtra> extras = new ArrayList<>();

    @Setter(AccessLevel.NONE)
    @Column(name = "extras_total", precision = 10, scale = 2)
    private BigDecimal extrasTotal = BigDecimal.ZERO;

    @Setter(AccessLevel.NONE)
    @Column(name = "profit", precision = 10, scale = 2)
    private BigDecimal profit = BigDecimal.ZERO;

    @Column(name = "currency", length = 3)
    private String currency = "GBP";

    @Column(name = "customer_invoice_id")
    private UUID customerInvoiceId;

    @Column(name = "fleet_invoice_id")
    private UUID fleetInvoiceId;

    @Column(name = "driver_invoice_id")
    private UUID driverInvoiceId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Prices and extras start empty; set them with {@link #applyPricing}.
     */
    @Builder
    public Booking(UUID id, Long version, String bookingRef,
                   String customerName, String customerEmail, String customerPhone,
                   String pickupLocation, String dropoffLocation, LocalDate pickupDate, LocalTime pickupTime,
                   int passengers, String vehicleClassId, BookingStatus status,
                   String fleetId, String driverId, String currency,
                   UUID customerInvoiceId, UUID fleetInvoiceId, UUID driverInvoiceId) {
        this.id = id;
        this.version = version;
        this.bookingRef = bookingRef;
        this.customerName = customerName;
        this.customerEmail = customerEmail;
        this.customerPhone = customerPhone;
        this.pickupLocation = pickupLocation;
        this.dropoffLocation = dropoffLocation;
        this.pickupDate = pickupDate;
        this.pickupTime = pickupTime;
        this.passengers = passengers;
        this.vehicleClassId = vehicleClassId;
        this.status = status;
        this.fleetId = fleetId;
        this.driverId = driverId;
        this.currency = currency != null ? currency : "GBP";
        this.customerInvoiceId = customerInvoiceId;
        this.fleetInvoiceId = fleetInvoiceId;
        this.driverInvoiceId = driverInvoiceId;
    }

    /**
     * The only way prices, extras and the derived profit change, always together.
     */
    public void applyPricing(BigDecimal customerPrice, BigDecimal driverPrice,
                             List<BookingExtra> extras, DualPriceAssigner assigner) {
        PriceAssignment assignment = assigner.assign(customerPrice, driverPrice, extras);
        this.customerPrice = customerPrice;
        this.driverPrice = driverPrice;
        this.extras = extras != null ? new ArrayList<>(extras) : new ArrayList<>();
        this.extrasTotal = assignment.extrasTotal();
        this.profit = assignment.profit();
    }

    public List<BookingExtra> getExtras() {
        return Collections.unmodifiableList(extras);
    }

    public UUID invoiceIdFor(InvoiceType type) {
        return switch (type) {
            case CUSTOMER -> customerInvoiceId;
            case FLEET -> fleetInvoiceId;
            case DRIVER -> driverInvoiceId;
            case CUSTOM -> null;
        };
    }

    public void stampInvoice(InvoiceType type, UUID invoiceId) {
        switch (type) {
            case CUSTOMER -> customerInvoiceId = invoiceId;
            case FLEET -> fleetInvoiceId = invoiceId;
            case DRIVER -> driverInvoiceId = invoiceId;
            case CUSTOM -> throw new IllegalArgumentException("Custom invoices are not linked to bookings");
        }
    }

    public boolean isPayoutInvoiced() {
        return fleetInvoiceId != null || driverInvoiceId != null;
    }
}

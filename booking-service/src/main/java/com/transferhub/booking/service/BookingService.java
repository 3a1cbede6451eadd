package com.transferhub.booking.service;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.BookingExtra;
import com.transferhub.booking.exception.BookingException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.CreateBookingRequest;
import com.transferhub.booking.model.ReassignRequest;
import com.transferhub.booking.model.UpdatePricingRequest;
import com.transferhub.booking.repository.BookingRepository;
import com.transferhub.shared.enums.BookingStatus;
import com.transferhub.shared.events.BookingEvent;
import com.transferhub.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Booking writes. Every path that touches customerPrice, driverPrice, extras or the
 * driver assignment goes through {@link #reprice} inside one transaction, so the stored
 * profit always matches the stored inputs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final int MAX_REF_ATTEMPTS = 5;

    private final BookingRepository bookingRepository;
    private final DualPriceAssigner priceAssigner;
    private final BookingRefGenerator refGenerator;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final BillingMetrics metrics;

    @Transactional
    public Booking create(CreateBookingRequest req) {
        boolean assigned = req.getFleetId() != null || req.getDriverId() != null;

        Booking booking = Booking.builder()
                .bookingRef(uniqueRef())
                .customerName(req.getCustomerName())
                .customerEmail(req.getCustomerEmail())
                .customerPhone(req.getCustomerPhone())
                .pickupLocation(req.getPickupLocation())
                .dropoffLocation(req.getDropoffLocation())
                .pickupDate(req.getPickupDate())
                .pickupTime(req.getPickupTime())
                .passengers(req.getPassengers())
                .vehicleClassId(req.getVehicleClassId())
                .fleetId(req.getFleetId())
                .driverId(req.getDriverId())
                .status(assigned ? BookingStatus.ASSIGNED : BookingStatus.PENDING)
                .currency(req.getCurrency() != null ? req.getCurrency() : "GBP")
                .build();
        reprice(booking, req.getCustomerPrice(), req.getDriverPrice(), req.getExtras());

        booking = bookingRepository.save(booking);
        publish(KafkaTopics.BOOKING_CREATED, booking, null);

        log.info("Booking {} created: customerPrice={} driverPrice={} extrasTotal={} profit={}",
                booking.getBookingRef(), booking.getCustomerPrice(), booking.getDriverPrice(),
                booking.getExtrasTotal(), booking.getProfit());
        return booking;
    }

    @Transactional
    public Booking updatePricing(UUID bookingId, UpdatePricingRequest req) {
        Booking booking = getBooking(bookingId);
        checkVersion(booking, req.getExpectedVersion());
        requireEditable(booking);

        BigDecimal customerPrice = req.getCustomerPrice() != null ? req.getCustomerPrice() : booking.getCustomerPrice();
        BigDecimal driverPrice = req.getDriverPrice() != null ? req.getDriverPrice() : booking.getDriverPrice();
        List<BookingExtra> extras = req.getExtras() != null ? req.getExtras() : booking.getExtras();

        BigDecimal previousProfit = booking.getProfit();
        reprice(booking, customerPrice, driverPrice, extras);
        booking = bookingRepository.save(booking);
        metrics.recordBookingRepriced();
        publish(KafkaTopics.BOOKING_PRICE_CHANGED, booking, null);

        log.info("Booking {} repriced: profit {} -> {}", booking.getBookingRef(), previousProfit, booking.getProfit());
        return booking;
    }

    /**
     * Moves the job to another fleet/driver at a new driver price. Refused once a payout
     * invoice references the booking.
     */
    @Transactional
    public Booking reassign(UUID bookingId, ReassignRequest req) {
        Booking booking = getBooking(bookingId);
        checkVersion(booking, req.getExpectedVersion());
        requireEditable(booking);
        if (booking.isPayoutInvoiced()) {
            throw new BookingException("ALREADY_INVOICED",
                    "Booking " + booking.getBookingRef() + " is already on a fleet or driver invoice");
        }

        String previousDriverId = booking.getDriverId();
        BigDecimal previousProfit = booking.getProfit();

        booking.setFleetId(req.getFleetId());
        booking.setDriverId(req.getDriverId());
        if (booking.getStatus() == BookingStatus.PENDING || booking.getStatus() == BookingStatus.CONFIRMED) {
            booking.setStatus(BookingStatus.ASSIGNED);
        }
        reprice(booking, booking.getCustomerPrice(), req.getDriverPrice(), booking.getExtras());

        booking = bookingRepository.save(booking);
        metrics.recordBookingRepriced();
        publish(KafkaTopics.BOOKING_REASSIGNED, booking, previousDriverId);

        log.info("Booking {} reassigned: driver {} -> {} fleet={} driverPrice={} profit {} -> {}",
                booking.getBookingRef(), previousDriverId, booking.getDriverId(), booking.getFleetId(),
                booking.getDriverPrice(), previousProfit, booking.getProfit());
        return booking;
    }

    @Transactional
    public Booking complete(UUID bookingId) {
        Booking booking = getBooking(bookingId);
        requireEditable(booking);

        booking.setStatus(BookingStatus.COMPLETED);
        booking = bookingRepository.save(booking);
        publish(KafkaTopics.BOOKING_COMPLETED, booking, null);

        log.info("Booking {} completed", booking.getBookingRef());
        return booking;
    }

    @Transactional
    public Booking cancel(UUID bookingId) {
        Booking booking = getBooking(bookingId);
        requireEditable(booking);

        booking.setStatus(BookingStatus.CANCELLED);
        log.info("Booking {} cancelled", booking.getBookingRef());
        return bookingRepository.save(booking);
    }

    @Transactional(readOnly = true)
    public Booking getBooking(UUID bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingException("BOOKING_NOT_FOUND", "Booking " + bookingId + " not found"));
    }

    private void reprice(Booking booking, BigDecimal customerPrice, BigDecimal driverPrice, List<BookingExtra> extras) {
        booking.applyPricing(customerPrice, driverPrice, extras, priceAssigner);
    }

    private static void checkVersion(Booking booking, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(booking.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(Booking.class, booking.getId());
        }
    }

    private static void requireEditable(Booking booking) {
        if (booking.getStatus() == BookingStatus.COMPLETED || booking.getStatus() == BookingStatus.CANCELLED) {
            throw new BookingException("INVALID_STATUS",
                    "Booking " + booking.getBookingRef() + " is " + booking.getStatus());
        }
    }

    private String uniqueRef() {
        for (int i = 0; i < MAX_REF_ATTEMPTS; i++) {
            String ref = refGenerator.next();
            if (!bookingRepository.existsByBookingRef(ref)) {
                return ref;
            }
            log.warn("Booking ref collision on {}, retrying", ref);
        }
        throw new IllegalStateException("Could not allocate a unique booking ref");
    }

    private void publish(String topic, Booking booking, String previousDriverId) {
        kafkaTemplate.send(topic, booking.getId().toString(), BookingEvent.builder()
                .bookingId(booking.getId().toString())
                .bookingRef(booking.getBookingRef())
                .status(booking.getStatus())
                .fleetId(booking.getFleetId())
                .driverId(booking.getDriverId())
                .previousDriverId(previousDriverId)
                .customerPrice(booking.getCustomerPrice())
                .driverPrice(booking.getDriverPrice())
                .extrasTotal(booking.getExtrasTotal())
                .profit(booking.getProfit())
                .currency(booking.getCurrency())
                .eventTime(Instant.now())
                .build());
    }
}

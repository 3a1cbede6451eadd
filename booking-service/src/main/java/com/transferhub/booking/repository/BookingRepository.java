package com.transferhub.booking.repository;

import com.transferhub.booking.entity.Booking;
import com.transferhub.shared.enums.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BookingRepository extends JpaRepository<Booking, UUID> {

    Optional<Booking> findByBookingRef(String bookingRef);

    boolean existsByBookingRef(String bookingRef);

    List<Booking> findByStatusAndCustomerInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus status);

    List<Booking> findByStatusAndFleetInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus status);

    List<Booking> findByStatusAndDriverInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus status);

    List<Booking> findByCustomerInvoiceId(UUID invoiceId);

    List<Booking> findByFleetInvoiceId(UUID invoiceId);

    List<Booking> findByDriverInvoiceId(UUID invoiceId);
}
